package io.intellixity.squrrl.clause;

public enum SortDirection { ASC, DESC }
