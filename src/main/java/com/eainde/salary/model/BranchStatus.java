package com.eainde.salary.model;

/**
 * How an observation-gathering branch finished.
 */
public enum BranchStatus {
    OK,
    EMPTY,
    FAILED,
    TIMED_OUT;

    public boolean isDegraded() {
        return this == FAILED || this == TIMED_OUT;
    }
}
