package com.capacityengine.counter;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persistent monotonic counter, one row per scope.
 */
@Entity
@Table(name = "counters")
@Data
@NoArgsConstructor
public class Counter {

    @Id
    private String scope;

    @Column(name = "next_value", nullable = false)
    private long nextValue;

    public Counter(String scope) {
        this.scope = scope;
        this.nextValue = 0;
    }

    /**
     * @return the current value, advancing the counter past it
     */
    public long take() {
        long value = nextValue;
        nextValue = Math.addExact(nextValue, 1);
        return value;
    }
}
