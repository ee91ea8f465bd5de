package com.eainde.salary.model;

import java.io.Serializable;
import java.util.List;

/**
 * Owned result of one parallel branch. Each branch writes its own outcome;
 * the aggregation step unions them.
 *
 * @param branch       branch name, used in logs and reasoning
 * @param status       completion status
 * @param observations observations returned, empty unless {@code status == OK}
 * @param detail       failure description, or null
 */
public record BranchOutcome(
        String branch,
        BranchStatus status,
        List<Observation> observations,
        String detail
) implements Serializable {

    public BranchOutcome {
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public static BranchOutcome of(String branch, List<Observation> observations) {
        List<Observation> safe = observations == null ? List.of() : observations;
        return new BranchOutcome(branch, safe.isEmpty() ? BranchStatus.EMPTY : BranchStatus.OK, safe, null);
    }

    public static BranchOutcome failed(String branch, String detail) {
        return new BranchOutcome(branch, BranchStatus.FAILED, List.of(), detail);
    }

    public static BranchOutcome timedOut(String branch, String detail) {
        return new BranchOutcome(branch, BranchStatus.TIMED_OUT, List.of(), detail);
    }
}
