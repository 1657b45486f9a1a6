package com.capacityengine.subscription;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Identity of a subscription: its owner and the owner-local sequence number.
 */
@Embeddable
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionKey implements Serializable {

    @Column(name = "owner", nullable = false)
    private String owner;

    @Column(name = "local_id", nullable = false)
    private int localId;

    @Override
    public String toString() {
        return owner + "/" + localId;
    }
}
