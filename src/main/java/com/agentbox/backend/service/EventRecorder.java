package com.agentbox.backend.service;

import com.agentbox.backend.common.Constants;
import com.agentbox.backend.configuration.CallerIdentity;
import com.agentbox.backend.entity.Event;
import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.repository.EventRepository;
import lombok.AccessLevel;
import lombok.RequiredArgsConstructor;
import lombok.experimental.FieldDefaults;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Append-only audit trail. Writes never block or fail the caller: invalid metadata and
 * storage errors are logged and dropped.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@FieldDefaults(level = AccessLevel.PRIVATE, makeFinal = true)
public class EventRecorder {
    EventRepository eventRepository;

    @Qualifier("eventExecutor")
    Executor eventExecutor;

    public void record(EventType type, String actorType, String actorId, Long instanceId, Map<String, ?> metadata) {
        Map<String, Object> copy = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
        if (!type.accepts(copy)) {
            log.warn("Dropping {} event: metadata {} lacks required keys {}", type.key(), copy.keySet(), type.requiredKeys());
            return;
        }

        Event event = Event.builder()
                .timestamp(Instant.now())
                .eventType(type)
                .actorType(actorType)
                .actorId(actorId)
                .entityType(instanceId == null ? null : Constants.ENTITY.INSTANCE)
                .entityId(instanceId == null ? null : String.valueOf(instanceId))
                .metadata(copy)
                .build();

        try {
            eventExecutor.execute(() -> save(event));
        } catch (RejectedExecutionException e) {
            log.warn("Event queue full, dropping {} for instance {}", type.key(), instanceId);
        }
    }

    public void record(EventType type, CallerIdentity caller, Long instanceId, Map<String, ?> metadata) {
        record(type, caller.actorType(), caller.getName(), instanceId, metadata);
    }

    public void recordSystem(EventType type, String actorId, Long instanceId, Map<String, ?> metadata) {
        record(type, Constants.ACTOR.SYSTEM, actorId, instanceId, metadata);
    }

    private void save(Event event) {
        try {
            eventRepository.save(event);
        } catch (Exception e) {
            log.warn("Failed to store {} event for {}: {}", event.getEventType().key(), event.getEntityId(), e.getMessage());
        }
    }
}
