package io.intellixity.squrrl.clause;

public enum FrameExclusion {
  CURRENT_ROW("EXCLUDE CURRENT ROW"),
  GROUP("EXCLUDE GROUP"),
  TIES("EXCLUDE TIES"),
  NO_OTHERS("EXCLUDE NO OTHERS");

  private final String sql;

  FrameExclusion(String sql) {
    this.sql = sql;
  }

  public String sql() { return sql; }
}
