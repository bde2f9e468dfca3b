package com.clinicflow.backend.modules.queue.domain;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Optional;

/**
 * Sort value of a queue position: priority rank and check-in time. Both are needed because the
 * queue is ordered by rank first, so a time-only cursor would skip or repeat rows.
 */
public record QueueCursor(int priorityRank, OffsetDateTime checkInTime) {

    private static final String SEPARATOR = "|";

    public static QueueCursor of(OpdQueueSnapshot entry) {
        return new QueueCursor(entry.getPriorityRank(), entry.getCheckInTime());
    }

    public String toSortValue() {
        return priorityRank + SEPARATOR + checkInTime;
    }

    public static Optional<QueueCursor> parse(String sortValue) {
        if (sortValue == null) {
            return Optional.empty();
        }
        int separator = sortValue.indexOf(SEPARATOR);
        if (separator <= 0) {
            return Optional.empty();
        }
        try {
            int rank = Integer.parseInt(sortValue.substring(0, separator));
            OffsetDateTime time = OffsetDateTime.parse(sortValue.substring(separator + 1));
            return Optional.of(new QueueCursor(rank, time));
        } catch (NumberFormatException | DateTimeParseException ex) {
            return Optional.empty();
        }
    }
}
