package com.agentbox.backend.entity;

import com.agentbox.backend.entity.enumeration.EventType;
import com.agentbox.backend.utils.EventTypeConverter;
import com.agentbox.backend.utils.MapJsonConverter;
import jakarta.persistence.*;
import lombok.*;
import lombok.experimental.FieldDefaults;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.Map;

/**
 * Append-only audit record. Rows are inserted once and never updated.
 */
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@FieldDefaults(level = AccessLevel.PRIVATE)
@Entity
@Immutable
@Table(name = "events", indexes = {
        @Index(name = "events_timestamp_idx", columnList = "event_timestamp"),
        @Index(name = "events_event_type_idx", columnList = "event_type"),
        @Index(name = "events_entity_idx", columnList = "entity_type,entity_id")
})
public class Event {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    Long id;

    @Column(name = "event_timestamp", nullable = false)
    Instant timestamp;

    @Convert(converter = EventTypeConverter.class)
    @Column(name = "event_type", nullable = false, length = 64)
    EventType eventType;

    @Column(name = "actor_type", nullable = false, length = 32)
    String actorType;

    @Column(name = "actor_id", nullable = false, length = 64)
    String actorId;

    @Column(name = "entity_type", length = 32)
    String entityType;

    @Column(name = "entity_id", length = 64)
    String entityId;

    @Lob
    @Convert(converter = MapJsonConverter.class)
    Map<String, Object> metadata;
}
