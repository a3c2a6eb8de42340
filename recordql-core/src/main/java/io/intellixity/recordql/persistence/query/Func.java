package io.intellixity.recordql.persistence.query;

/** Named function usable inside expressions, functional predicates and sorts. */
public sealed interface Func permits DistanceFunc, CountFunc, UserDataFunc, UserRelationFunc, UserDiscoverFunc {
  <R> R accept(FuncVisitor<R> visitor);
}
