package com.clinicflow.backend.modules.queue.domain;

public record QueueCounts(long waiting, long inProgress) {

    public long total() {
        return waiting + inProgress;
    }
}
