package io.intellixity.squrrl.clause;

public enum JoinType {
  INNER("INNER JOIN", false),
  LEFT("LEFT JOIN", false),
  RIGHT("RIGHT JOIN", false),
  FULL("FULL JOIN", false),

  NATURAL_INNER("NATURAL INNER JOIN", true),
  NATURAL_LEFT("NATURAL LEFT JOIN", true),
  NATURAL_RIGHT("NATURAL RIGHT JOIN", true),
  NATURAL_FULL("NATURAL FULL JOIN", true),

  CROSS("CROSS JOIN", true);

  private final String keyword;
  private final boolean unconditional;

  JoinType(String keyword, boolean unconditional) {
    this.keyword = keyword;
    this.unconditional = unconditional;
  }

  public String keyword() { return keyword; }

  /** NATURAL and CROSS joins take neither ON nor USING. */
  public boolean unconditional() { return unconditional; }
}
