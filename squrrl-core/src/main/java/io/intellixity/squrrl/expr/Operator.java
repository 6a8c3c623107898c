package io.intellixity.squrrl.expr;

/** Common comparison operators. Conditions accept any other operator text verbatim. */
public enum Operator {
  EQ("="),
  NE("!="),
  GT(">"),
  GE(">="),
  LT("<"),
  LE("<="),

  IS("IS"),
  IS_NOT("IS NOT"),

  IN("IN"),
  NOT_IN("NOT IN"),

  LIKE("LIKE"),
  NOT_LIKE("NOT LIKE");

  private final String symbol;

  Operator(String symbol) {
    this.symbol = symbol;
  }

  public String symbol() {
    return symbol;
  }
}
