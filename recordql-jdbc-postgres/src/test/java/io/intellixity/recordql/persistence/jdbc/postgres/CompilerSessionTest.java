package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.Predicates;
import io.intellixity.recordql.persistence.query.Sort;
import io.intellixity.recordql.persistence.query.SortOrder;
import io.intellixity.recordql.persistence.query.UserDiscoverFunc;
import io.intellixity.recordql.persistence.schema.DataType;
import io.intellixity.recordql.persistence.schema.FieldType;
import io.intellixity.recordql.persistence.schema.RecordSchema;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class CompilerSessionTest {
  private static CompilerSession session() {
    return new CompilerSession(PostgresSettings.defaults(), "note");
  }

  @Test
  void sameJoinSpecReturnsSameAlias() {
    CompilerSession s = session();
    String first = s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    String second = s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    assertEquals("_t0", first);
    assertEquals(first, second);
    assertEquals(1, s.joins().size());
  }

  @Test
  void joinSpecsDifferingInAnyFieldGetDistinctAliases() {
    CompilerSession s = session();
    String base = s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    String otherTable = s.requestJoin(new JoinSpec("_follow", "_owner_id", "right_id"));
    String otherPrimary = s.requestJoin(new JoinSpec("_friend", "author", "right_id"));
    String otherSecondary = s.requestJoin(new JoinSpec("_friend", "_owner_id", "left_id"));

    assertEquals(List.of("_t0", "_t1", "_t2", "_t3"), List.of(base, otherTable, otherPrimary, otherSecondary));
  }

  @Test
  void userTableAlwaysAliasedAsUser() {
    CompilerSession s = session();
    s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    s.requestJoin(new JoinSpec("_follow", "_owner_id", "right_id"));
    assertEquals("_user", s.requestJoin(new JoinSpec("_user", "_id", "id")));
    assertEquals("_user", s.requestJoin(new JoinSpec("_user", "_owner_id", "id")));
    assertEquals(4, s.joins().size());
  }

  @Test
  void noJoinsMeansNoDistinct() {
    JoinClauses jc = session().renderJoins();
    assertFalse(jc.requiresDistinct());
    assertTrue(jc.clauses().isEmpty());
  }

  @Test
  void rendersLeftJoinsInInsertionOrder() {
    CompilerSession s = session();
    s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    s.requestJoin(new JoinSpec("_friend", "_owner_id", "left_id"));

    JoinClauses jc = s.renderJoins();
    assertTrue(jc.requiresDistinct());
    assertEquals(List.of(
        "LEFT JOIN \"public\".\"_friend\" AS \"_t0\" ON \"note\".\"_owner_id\" = \"_t0\".\"right_id\"",
        "LEFT JOIN \"public\".\"_friend\" AS \"_t1\" ON \"note\".\"_owner_id\" = \"_t1\".\"left_id\""),
        jc.clauses());
  }

  @Test
  void drainExtendsSchemaWithoutReplacingExistingColumns() {
    CompilerSession s = new CompilerSession(PostgresSettings.defaults(), "user");
    s.compile(Predicates.functional(UserDiscoverFunc.byEmails(List.of("a@x.com"))));

    RecordSchema schema = RecordSchema.builder()
        .field("username", DataType.STRING)
        .field("_transient__username", DataType.JSON)
        .build();
    CompilerSession.Output out = s.drain(schema);

    assertTrue(out.joins().requiresDistinct());
    assertEquals(3, out.schema().size());
    assertEquals(FieldType.of(DataType.JSON), out.schema().get("_transient__username"));
    assertTrue(out.schema().get("_transient__email").isComputed());
    assertEquals(2, schema.size());
  }

  @Test
  void drainedSessionRejectsFurtherUse() {
    CompilerSession s = session();
    s.drain(RecordSchema.empty());
    assertThrows(IllegalStateException.class, () -> s.compile(Predicates.eq("a", 1)));
    assertThrows(IllegalStateException.class, () -> s.compileSort(Sort.by("a", SortOrder.ASC)));
    assertThrows(IllegalStateException.class, () -> s.requestJoin(new JoinSpec("_friend", "a", "b")));
    assertThrows(IllegalStateException.class, () -> s.drain(RecordSchema.empty()));
  }

  @Test
  void unqualifiedTableNamesWithoutSchema() {
    CompilerSession s = new CompilerSession(PostgresSettings.defaults().withSchema(""), "note");
    s.requestJoin(new JoinSpec("_friend", "_owner_id", "right_id"));
    assertEquals("LEFT JOIN \"_friend\" AS \"_t0\" ON \"note\".\"_owner_id\" = \"_t0\".\"right_id\"",
        s.renderJoins().clauses().get(0));
  }
}
