package com.capacityengine.delegation;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Permission for {@code delegate} to use subscription {@code owner/localId}.
 */
@Entity
@Table(name = "access_grants", uniqueConstraints = {
    @UniqueConstraint(name = "uk_grant", columnNames = {"owner", "local_id", "delegate"})
})
@Data
@NoArgsConstructor
public class AccessGrant {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long grantId;

    @Column(name = "owner", nullable = false)
    private String owner;

    @Column(name = "local_id", nullable = false)
    private int localId;

    @Column(name = "delegate", nullable = false)
    private String delegate;

    @Column(name = "granted_at", nullable = false, updatable = false)
    private Instant grantedAt;

    public AccessGrant(String owner, int localId, String delegate, Instant grantedAt) {
        this.owner = owner;
        this.localId = localId;
        this.delegate = delegate;
        this.grantedAt = grantedAt;
    }
}
