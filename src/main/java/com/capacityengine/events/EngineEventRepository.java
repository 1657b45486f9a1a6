package com.capacityengine.events;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EngineEventRepository extends JpaRepository<EngineEvent, Long> {

    List<EngineEvent> findByEventTypeOrderByEventIdAsc(EngineEventType eventType);

    List<EngineEvent> findAllByOrderByEventIdAsc();
}
