package com.capacityengine.dispatch;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Opaque note stored by the {@code remark} operation.
 */
@Entity
@Table(name = "remarks")
@Data
@NoArgsConstructor
public class Remark {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long remarkId;

    @Column(name = "signer", nullable = false)
    private String signer;

    @Column(name = "payload", length = RemarkOperationHandler.MAX_PAYLOAD_LENGTH)
    private String payload;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public Remark(String signer, String payload, Instant createdAt) {
        this.signer = signer;
        this.payload = payload;
        this.createdAt = createdAt;
    }
}
