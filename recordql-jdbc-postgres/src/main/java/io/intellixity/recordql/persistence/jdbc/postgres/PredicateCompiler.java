package io.intellixity.recordql.persistence.jdbc.postgres;

import io.intellixity.recordql.persistence.query.*;

import java.util.ArrayList;
import java.util.List;

import static io.intellixity.recordql.persistence.query.QueryValidationException.Reason.UNSUPPORTED_OPERATOR;

/** Recursive-descent compiler from a predicate tree to a single WHERE fragment. */
final class PredicateCompiler implements PredicateVisitor<SqlFragment> {
  private final CompilerSession session;
  private final ExpressionCompiler expressions;

  PredicateCompiler(CompilerSession session) {
    this.session = session;
    this.expressions = new ExpressionCompiler(session.primaryTable());
  }

  SqlFragment compile(Predicate predicate) {
    if (predicate == null || predicate.isEmpty()) {
      throw new MalformedQueryException("no SQL can be compiled from an empty predicate");
    }
    return predicate.accept(this);
  }

  @Override
  public SqlFragment visit(CompoundPredicate compound) {
    return switch (compound.operator()) {
      case AND -> junction(compound, " AND ");
      case OR -> junction(compound, " OR ");
      case NOT -> {
        if (compound.children().size() != 1) {
          throw new MalformedQueryException("NOT takes exactly one predicate, got " + compound.children().size());
        }
        SqlFragment child = compile(compound.children().get(0));
        yield new SqlFragment("NOT (" + child.sql() + ")", child.args());
      }
      default -> throw new QueryValidationException(UNSUPPORTED_OPERATOR,
          "Compound operator `" + compound.operator() + "` is not supported.");
    };
  }

  private SqlFragment junction(CompoundPredicate compound, String separator) {
    List<SqlFragment> parts = new ArrayList<>(compound.children().size());
    for (Predicate child : compound.children()) {
      parts.add(compile(child));
    }
    SqlFragment joined = SqlFragment.join(separator, parts);
    return new SqlFragment("(" + joined.sql() + ")", joined.args());
  }

  @Override
  public SqlFragment visit(ComparisonPredicate comparison) {
    Operator op = comparison.operator();
    if (op == Operator.IN) return expressions.compileIn(comparison);

    String sqlOp = switch (op) {
      case EQUAL -> "=";
      case NOT_EQUAL -> "<>";
      case GREATER_THAN -> ">";
      case LESS_THAN -> "<";
      case GREATER_THAN_OR_EQUAL -> ">=";
      case LESS_THAN_OR_EQUAL -> "<=";
      case LIKE -> "LIKE";
      case ILIKE -> "ILIKE";
      default -> throw new QueryValidationException(UNSUPPORTED_OPERATOR,
          "Comparison operator `" + op + "` is not supported.");
    };

    SqlFragment lhs = expressions.compile(comparison.left());
    SqlFragment rhs = expressions.compile(comparison.right());
    List<Object> args = new ArrayList<>(lhs.args());
    args.addAll(rhs.args());
    return new SqlFragment(lhs.sql() + " " + sqlOp + " " + rhs.sql(), args);
  }

  @Override
  public SqlFragment visit(FunctionalPredicate functional) {
    if (!(functional.expression() instanceof FunctionCall call)) {
      throw new MalformedQueryException("unexpected expression in functional predicate: " + functional.expression());
    }
    return call.func().accept(new FunctionalPredicateTranslator(session));
  }
}
