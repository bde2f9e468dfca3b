package com.clinicflow.backend.global.pagination;

import java.util.List;
import java.util.function.Function;

/**
 * One page of a keyset listing. {@code nextCursor} is null exactly when {@code hasMore} is false.
 */
public record CursorPage<T>(List<T> items, String nextCursor, boolean hasMore) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT = 100;

    public CursorPage {
        items = List.copyOf(items);
    }

    public static int clampLimit(Integer requested) {
        if (requested == null) {
            return DEFAULT_LIMIT;
        }
        return Math.min(Math.max(requested, 1), MAX_LIMIT);
    }

    /**
     * Builds a page from a query that fetched {@code limit + 1} rows: the extra row only signals
     * that another page exists and is never returned.
     */
    public static <T> CursorPage<T> fromOverfetch(List<T> rows, int limit, Function<T, String> cursorOf) {
        boolean hasMore = rows.size() > limit;
        List<T> items = hasMore ? rows.subList(0, limit) : rows;
        String nextCursor = hasMore && !items.isEmpty() ? cursorOf.apply(items.get(items.size() - 1)) : null;
        return new CursorPage<>(items, nextCursor, hasMore && nextCursor != null);
    }

    public static <T> CursorPage<T> empty() {
        return new CursorPage<>(List.of(), null, false);
    }

    public <R> CursorPage<R> map(Function<T, R> mapper) {
        return new CursorPage<>(items.stream().map(mapper).toList(), nextCursor, hasMore);
    }
}
