package com.capacityengine.delegation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AccessGrantRepository extends JpaRepository<AccessGrant, Long> {

    Optional<AccessGrant> findByOwnerAndLocalIdAndDelegate(String owner, int localId, String delegate);

    boolean existsByOwnerAndLocalIdAndDelegate(String owner, int localId, String delegate);

    List<AccessGrant> findByOwnerAndLocalId(String owner, int localId);

    long deleteByOwnerAndLocalId(String owner, int localId);
}
