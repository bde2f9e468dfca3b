package com.clinicflow.backend.global.pagination;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import com.clinicflow.backend.global.pagination.KeysetPredicate.Direction;
import com.clinicflow.backend.global.pagination.KeysetPredicate.SortKey;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KeysetPredicateTest {

    @Test
    @DisplayName("descending keys compare with less-than and tie-break on equality of earlier keys")
    void descendingPair() {
        List<SortKey> keys = List.of(
                new SortKey("a.created_at", Direction.DESC, "cursorCreatedAt"),
                new SortKey("a.id", Direction.DESC, "cursorId"));

        assertThat(KeysetPredicate.after(keys)).isEqualTo(
                "((a.created_at < :cursorCreatedAt) OR (a.created_at = :cursorCreatedAt AND a.id < :cursorId))");
        assertThat(KeysetPredicate.orderBy(keys)).isEqualTo(" ORDER BY a.created_at DESC, a.id DESC");
    }

    @Test
    @DisplayName("mixed directions follow each key")
    void mixedDirections() {
        List<SortKey> keys = List.of(
                new SortKey("q.priority_rank", Direction.DESC, "r"),
                new SortKey("q.check_in_time", Direction.ASC, "t"),
                new SortKey("q.id", Direction.ASC, "i"));

        assertThat(KeysetPredicate.after(keys)).isEqualTo(
                "((q.priority_rank < :r) OR (q.priority_rank = :r AND q.check_in_time > :t)"
                        + " OR (q.priority_rank = :r AND q.check_in_time = :t AND q.id > :i))");
    }

    @Test
    void emptyKeysRejected() {
        assertThatThrownBy(() -> KeysetPredicate.after(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
