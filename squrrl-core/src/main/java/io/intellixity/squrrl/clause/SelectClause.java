package io.intellixity.squrrl.clause;

import io.intellixity.squrrl.expr.Expression;
import io.intellixity.squrrl.expr.Literal;
import io.intellixity.squrrl.statement.MalformedExpressionException;

import java.util.ArrayList;
import java.util.List;

/**
 * The projection: {@code SELECT [DISTINCT [ON (..)]] item, item, ...}.
 * <p>
 * The literal {@code *} and a plain item list are both the {@code ALL} form.
 */
public record SelectClause(SetQuantifier quantifier, List<Expression> distinctOn, List<SelectItem> items)
    implements Clause {

  public SelectClause {
    quantifier = quantifier == null ? SetQuantifier.ALL : quantifier;
    distinctOn = MalformedExpressionException.copyOrEmpty(distinctOn, "DISTINCT ON requires expressions");
    items = MalformedExpressionException.requireNonEmpty(items, "SELECT requires at least one item");
    if (!distinctOn.isEmpty() && quantifier != SetQuantifier.DISTINCT) {
      throw new MalformedExpressionException("DISTINCT ON requires the DISTINCT quantifier");
    }
  }

  @Override
  public ClauseKey key() { return ClauseKey.SELECT; }

  public static SelectClause star() {
    return new SelectClause(SetQuantifier.ALL, List.of(), List.of(new ExpressionItem(Literal.STAR)));
  }

  public static SelectClause of(SelectItem... items) {
    return new SelectClause(SetQuantifier.ALL, List.of(), List.of(items));
  }

  /** Plain item list of literal expressions; {@code of("*")} is the star projection. */
  public static SelectClause of(String... items) {
    return new SelectClause(SetQuantifier.ALL, List.of(), literalItems(items));
  }

  public static SelectClause distinct(SelectItem... items) {
    return new SelectClause(SetQuantifier.DISTINCT, List.of(), List.of(items));
  }

  public static SelectClause distinctOn(List<Expression> on, SelectItem... items) {
    return new SelectClause(SetQuantifier.DISTINCT, on, List.of(items));
  }

  public boolean isStar() {
    return items.size() == 1 && items.get(0) instanceof ExpressionItem e && Literal.STAR.equals(e.expression());
  }

  static List<SelectItem> literalItems(String... items) {
    List<SelectItem> out = new ArrayList<>();
    for (String s : items) out.add(ExpressionItem.of(s));
    return out;
  }
}
