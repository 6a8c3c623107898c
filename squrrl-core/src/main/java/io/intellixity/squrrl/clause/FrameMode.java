package io.intellixity.squrrl.clause;

public enum FrameMode {
  RANGE,
  ROWS,
  GROUPS
}
