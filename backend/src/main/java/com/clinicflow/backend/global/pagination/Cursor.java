package com.clinicflow.backend.global.pagination;

import java.util.Objects;
import java.util.UUID;

/**
 * Decoded position in a keyset-ordered listing: the last row's sort value plus its id as tie-breaker.
 */
public record Cursor(String sortValue, UUID id) {

    public Cursor {
        Objects.requireNonNull(sortValue, "sortValue must not be null");
        Objects.requireNonNull(id, "id must not be null");
    }
}
