package com.clinicflow.backend.modules.appointment.domain;

import com.clinicflow.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.EmbeddedId;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;

/**
 * Last token handed out for one department on one day. Always read under a row lock.
 */
@Entity
@Table(name = "daily_token_counter")
public class DailyTokenCounter extends AbstractTimestampedEntity {

    @EmbeddedId
    private DailyTokenCounterId id;

    @Column(name = "last_value", nullable = false)
    private int lastValue;

    protected DailyTokenCounter() {
    }

    public DailyTokenCounter(DailyTokenCounterId id) {
        this.id = id;
    }

    public int next() {
        lastValue += 1;
        return lastValue;
    }

    public DailyTokenCounterId getId() {
        return id;
    }

    public int getLastValue() {
        return lastValue;
    }
}
