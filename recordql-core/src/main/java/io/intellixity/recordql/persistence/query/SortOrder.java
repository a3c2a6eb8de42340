package io.intellixity.recordql.persistence.query;

public enum SortOrder { ASC, DESC }
