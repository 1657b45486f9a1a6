package com.capacityengine.lock;

import com.capacityengine.subscription.SubscriptionKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface LockedAssetsRepository extends JpaRepository<LockedAssets, SubscriptionKey> {

    List<LockedAssets> findByIdOwner(String owner);
}
