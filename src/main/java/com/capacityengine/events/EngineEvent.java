package com.capacityengine.events;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Notification emitted by a state transition. Stored append-only.
 *
 * The attribute map holds the event's fields (auction id, bidder, cost and so on) as
 * strings. Attributes are looked up by name and carry no order.
 */
@Entity
@Table(name = "engine_events", indexes = {
    @Index(name = "idx_event_type", columnList = "event_type")
})
@Data
@NoArgsConstructor
public class EngineEvent {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long eventId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false)
    private EngineEventType eventType;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "engine_event_attributes", joinColumns = @JoinColumn(name = "event_id"))
    @MapKeyColumn(name = "attribute_name")
    @Column(name = "attribute_value")
    private Map<String, String> attributes = new HashMap<>();

    @Column(name = "occurred_at", nullable = false, updatable = false)
    private Instant occurredAt;

    public EngineEvent(EngineEventType eventType, Instant occurredAt) {
        this.eventType = eventType;
        this.occurredAt = occurredAt;
    }

    public EngineEvent with(String name, Object value) {
        attributes.put(name, value == null ? null : String.valueOf(value));
        return this;
    }

    public String get(String name) {
        return attributes.get(name);
    }
}
