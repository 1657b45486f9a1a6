package com.capacityengine.events;

import com.capacityengine.common.EngineClock;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Records engine notifications and forwards them to in-process listeners.
 *
 * Events are written in the caller's transaction, so a rolled back operation leaves
 * no notification behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EngineEventPublisher {

    private final EngineEventRepository eventRepository;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final EngineClock clock;

    public EngineEvent event(EngineEventType type) {
        return new EngineEvent(type, clock.now());
    }

    @Transactional
    public EngineEvent publish(EngineEvent event) {
        EngineEvent saved = eventRepository.save(event);
        log.info("Event {}: {}", saved.getEventType(), saved.getAttributes());
        applicationEventPublisher.publishEvent(saved);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<EngineEvent> getEvents() {
        return eventRepository.findAllByOrderByEventIdAsc();
    }

    @Transactional(readOnly = true)
    public List<EngineEvent> getEvents(EngineEventType type) {
        return eventRepository.findByEventTypeOrderByEventIdAsc(type);
    }
}
