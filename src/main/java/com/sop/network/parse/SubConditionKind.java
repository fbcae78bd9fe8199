package com.sop.network.parse;

/**
 * Kinds of items nested inside a branch.
 */
public enum SubConditionKind {
    /** Nested {@code Yes:} marker. */
    NESTED_YES,
    /** Nested {@code No:} marker. */
    NESTED_NO,
    /** Labeled sub-item such as {@code Provider-submitted:}. */
    LABELED
}
