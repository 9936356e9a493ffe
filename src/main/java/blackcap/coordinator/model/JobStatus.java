package blackcap.coordinator.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle status of a job.
 *
 * Transitions only move forward along PENDING -> SCHEDULED -> RUNNING -> terminal.
 * FAILED and CANCELLED can be entered from any non-terminal state, and nothing leaves a terminal state.
 */
public enum JobStatus {
    /** Submitted, not yet bound to a cluster */
    PENDING(0),
    /** Bound to a cluster by an active schedule */
    SCHEDULED(1),
    /** Backend reports the job running */
    RUNNING(2),
    /** Finished successfully */
    SUCCEEDED(3),
    /** Finished with an error or rejected by the backend */
    FAILED(3),
    /** Withdrawn by a user */
    CANCELLED(3);

    private final int rank;

    JobStatus(int rank) {
        this.rank = rank;
    }

    public boolean isTerminal() {
        return rank == 3;
    }

    /**
     * Check whether a job in this status may move to {@code next}.
     * Staying in the same status is not a transition.
     */
    public boolean canTransitionTo(JobStatus next) {
        if (next == null || next == this || isTerminal()) {
            return false;
        }
        if (next == FAILED || next == CANCELLED) {
            return true;
        }
        return next.rank > rank;
    }

    /** Statuses from which {@code target} may be entered (used for conditional updates). */
    public static Set<JobStatus> predecessorsOf(JobStatus target) {
        Set<JobStatus> result = EnumSet.noneOf(JobStatus.class);
        for (JobStatus status : values()) {
            if (status.canTransitionTo(target)) {
                result.add(status);
            }
        }
        return result;
    }
}
