package io.intellixity.recordql.persistence.query;

public interface FuncVisitor<R> {
  R visit(DistanceFunc distance);
  R visit(CountFunc count);
  R visit(UserDataFunc userData);
  R visit(UserRelationFunc userRelation);
  R visit(UserDiscoverFunc userDiscover);
}
