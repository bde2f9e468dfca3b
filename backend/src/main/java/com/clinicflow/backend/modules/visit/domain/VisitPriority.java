package com.clinicflow.backend.modules.visit.domain;

/**
 * Triage priority. {@link #rank()} is what the queue sorts by, highest first.
 */
public enum VisitPriority {
    EMERGENCY(4),
    URGENT(3),
    NORMAL(2),
    LOW(1);

    private final int rank;

    VisitPriority(int rank) {
        this.rank = rank;
    }

    public int rank() {
        return rank;
    }

    public static VisitPriority fromRank(int rank) {
        for (VisitPriority priority : values()) {
            if (priority.rank == rank) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority rank " + rank);
    }
}
