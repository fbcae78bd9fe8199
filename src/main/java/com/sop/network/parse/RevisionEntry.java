package com.sop.network.parse;

/**
 * One row of the revision-history table.
 */
public record RevisionEntry(String revision, String date, String description) {
}
