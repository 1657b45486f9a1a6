package com.capacityengine.subscription;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SubscriptionRepository extends JpaRepository<Subscription, SubscriptionKey> {

    List<Subscription> findByIdOwnerOrderByIdLocalIdAsc(String owner);
}
