package com.clinicflow.backend.global.pagination;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders the compound "strictly after the cursor row" predicate and matching ORDER BY
 * for a multi-column keyset, e.g. for {@code (created_at DESC, id DESC)}:
 * {@code (created_at < :c0) OR (created_at = :c0 AND id < :c1)}.
 * Callers bind one parameter per key, named by {@link SortKey#param()}.
 */
public final class KeysetPredicate {

    private KeysetPredicate() {
    }

    public enum Direction {
        ASC,
        DESC
    }

    public record SortKey(String column, Direction direction, String param) {
    }

    public static String after(List<SortKey> keys) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("At least one sort key is required");
        }
        List<String> disjuncts = new ArrayList<>();
        for (int i = 0; i < keys.size(); i++) {
            List<String> conjuncts = new ArrayList<>();
            for (int j = 0; j < i; j++) {
                SortKey equal = keys.get(j);
                conjuncts.add(equal.column() + " = :" + equal.param());
            }
            SortKey pivot = keys.get(i);
            String operator = pivot.direction() == Direction.DESC ? " < :" : " > :";
            conjuncts.add(pivot.column() + operator + pivot.param());
            disjuncts.add("(" + String.join(" AND ", conjuncts) + ")");
        }
        return "(" + String.join(" OR ", disjuncts) + ")";
    }

    public static String orderBy(List<SortKey> keys) {
        List<String> parts = new ArrayList<>();
        for (SortKey key : keys) {
            parts.add(key.column() + " " + key.direction().name());
        }
        return " ORDER BY " + String.join(", ", parts);
    }
}
