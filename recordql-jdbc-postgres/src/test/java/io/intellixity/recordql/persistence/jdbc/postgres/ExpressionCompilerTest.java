package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.*;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static io.intellixity.recordql.persistence.query.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class ExpressionCompilerTest {
  private final ExpressionCompiler compiler = new ExpressionCompiler("note");

  @Test
  void keyPathIsQualifiedAndQuoted() {
    SqlFragment f = compiler.compile(key("title"));
    assertEquals("\"note\".\"title\"", f.sql());
    assertTrue(f.args().isEmpty());
  }

  @Test
  void keyPathWithQuoteIsEscaped() {
    assertEquals("\"note\".\"we\"\"ird\"", compiler.compile(key("we\"ird")).sql());
  }

  @Test
  void scalarLiteralBindsOnePlaceholder() {
    SqlFragment f = compiler.compile(value(42));
    assertEquals("?", f.sql());
    assertEquals(List.of(42), f.args());
  }

  @Test
  void nullLiteralBindsNull() {
    SqlFragment f = compiler.compile(value(null));
    assertEquals("?", f.sql());
    assertEquals(Arrays.asList((Object) null), f.args());
  }

  @Test
  void referenceLiteralBindsItsKey() {
    SqlFragment f = compiler.compile(value(new Reference("note", "note-1")));
    assertEquals(List.of("note-1"), f.args());
  }

  @Test
  void arrayLiteralBindsEachElementInOrder() {
    SqlFragment f = compiler.compile(value(List.of("a", new Reference("note", "n2"), 3)));
    assertEquals("(?, ?, ?)", f.sql());
    assertEquals(List.of("a", "n2", 3), f.args());
  }

  @Test
  void javaArrayLiteralIsAnArray() {
    SqlFragment f = compiler.compile(value(new int[] {1, 2}));
    assertEquals("(?, ?)", f.sql());
    assertEquals(List.of(1, 2), f.args());
  }

  @Test
  void emptyArrayCompilesToNull() {
    SqlFragment f = compiler.compile(value(List.of()));
    assertEquals("(NULL)", f.sql());
    assertTrue(f.args().isEmpty());
  }

  @Test
  void distanceBindsLongitudeThenLatitude() {
    SqlFragment f = compiler.compile(call(new DistanceFunc("location", Location.of(22.3, 114.2))));
    assertEquals("ST_Distance_Sphere(\"note\".\"location\", ST_MakePoint(?, ?))", f.sql());
    assertEquals(List.of(114.2, 22.3), f.args());
  }

  @Test
  void countSelectsWindowFormForOverallRecords() {
    assertEquals("COUNT(*) OVER()", compiler.compile(call(new CountFunc(true))).sql());
    assertEquals("COUNT(*)", compiler.compile(call(new CountFunc(false))).sql());
  }

  @Test
  void userDataReferencesUserAlias() {
    SqlFragment f = compiler.compile(call(new UserDataFunc("email")));
    assertEquals("\"_user\".\"email\"", f.sql());
    assertTrue(f.args().isEmpty());
  }

  @Test
  void predicateFunctionsAreNotExpressions() {
    assertThrows(MalformedQueryException.class,
        () -> compiler.compile(call(new UserRelationFunc("", "_friend", "", "bob"))));
    assertThrows(MalformedQueryException.class,
        () -> compiler.compile(call(UserDiscoverFunc.byEmails(List.of("a@x.com")))));
  }

  @Test
  void inWithKeyPathOnLeftIsValueList() {
    SqlFragment f = compiler.compileIn(in("tag", List.of("a", "b")));
    assertEquals("\"note\".\"tag\" IN (?, ?)", f.sql());
    assertEquals(List.of("a", "b"), f.args());
  }

  @Test
  void inWithEmptyListMatchesNothing() {
    SqlFragment f = compiler.compileIn(in("tag", List.of()));
    assertEquals("\"note\".\"tag\" IN (NULL)", f.sql());
    assertTrue(f.args().isEmpty());
  }

  @Test
  void inWithScalarRightSideIsSingleElementList() {
    SqlFragment f = compiler.compileIn(new ComparisonPredicate(Operator.IN, key("tag"), value("a")));
    assertEquals("\"note\".\"tag\" IN (?)", f.sql());
    assertEquals(List.of("a"), f.args());
  }

  @Test
  void inWithLiteralOnLeftIsJsonbMembership() {
    SqlFragment f = compiler.compileIn(contains("tags", "urgent"));
    assertEquals("jsonb_exists(\"note\".\"tags\", ?)", f.sql());
    assertEquals(List.of("urgent"), f.args());
  }

  @Test
  void inWithOtherOperandKindsIsMalformed() {
    assertThrows(MalformedQueryException.class,
        () -> compiler.compileIn(new ComparisonPredicate(Operator.IN, key("a"), key("b"))));
    assertThrows(MalformedQueryException.class,
        () -> compiler.compileIn(new ComparisonPredicate(Operator.IN, value(1), value(List.of(1)))));
  }
}
