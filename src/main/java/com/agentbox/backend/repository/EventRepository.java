package com.agentbox.backend.repository;

import com.agentbox.backend.entity.Event;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface EventRepository extends JpaRepository<Event, Long> {

    List<Event> findAllByEntityTypeAndEntityIdOrderByIdAsc(String entityType, String entityId);
}
