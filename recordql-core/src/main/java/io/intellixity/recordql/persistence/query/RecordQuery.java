package io.intellixity.recordql.persistence.query;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import io.intellixity.recordql.persistence.acl.UserInfo;
import io.intellixity.recordql.persistence.query.json.RecordQueryJsonDeserializer;
import io.intellixity.recordql.persistence.query.json.RecordQueryJsonSerializer;

import java.util.*;

@JsonSerialize(using = RecordQueryJsonSerializer.class)
@JsonDeserialize(using = RecordQueryJsonDeserializer.class)
public final class RecordQuery {
  private String recordType;
  private Predicate predicate;
  private List<Sort> sorts = new ArrayList<>();
  private UserInfo viewAsUser;
  private boolean bypassAccessControl;
  private Integer limit;
  private int offset;
  private boolean withCount;

  public RecordQuery() {}

  public RecordQuery(String recordType) {
    this.recordType = recordType;
  }

  public String recordType() { return recordType; }
  /** Null means no filter. */
  public Predicate predicate() { return predicate; }
  public List<Sort> sorts() { return Collections.unmodifiableList(sorts); }
  public UserInfo viewAsUser() { return viewAsUser; }
  public boolean bypassAccessControl() { return bypassAccessControl; }
  public Integer limit() { return limit; }
  public int offset() { return offset; }
  /** Adds an overall record count column to every returned row. */
  public boolean withCount() { return withCount; }

  public RecordQuery withRecordType(String recordType) { this.recordType = recordType; return this; }
  public RecordQuery withPredicate(Predicate predicate) { this.predicate = predicate; return this; }
  public RecordQuery withSorts(List<Sort> sorts) { this.sorts = new ArrayList<>(sorts == null ? List.of() : sorts); return this; }
  public RecordQuery withSort(Sort sort) { this.sorts.add(Objects.requireNonNull(sort, "sort")); return this; }
  public RecordQuery viewAs(UserInfo user) { this.viewAsUser = user; return this; }
  public RecordQuery withBypassAccessControl(boolean bypass) { this.bypassAccessControl = bypass; return this; }
  public RecordQuery withCount(boolean withCount) { this.withCount = withCount; return this; }

  public RecordQuery withLimit(Integer limit) {
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = limit;
    return this;
  }

  public RecordQuery withOffset(int offset) {
    if (offset < 0) throw new IllegalArgumentException("offset must be >= 0");
    this.offset = offset;
    return this;
  }

  public static RecordQuery of(String recordType, Predicate predicate) {
    return new RecordQuery(recordType).withPredicate(predicate);
  }
}
