package io.intellixity.squrrl.clause;

public enum NullOrdering { FIRST, LAST }
