package com.e2eq.links.core;

import io.quarkus.logging.Log;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per entity type lifecycle events ({@code logs:{entityType}}). Best effort and switchable.
 */
public class LifecycleLog {

    public enum Event { CREATED, UPDATED, DONE, COLLECTED, DELETED }

    public record Entry(String entryId, String entityId, Event event, Instant at, Map<String, Object> details) {
        public Entry {
            details = details == null ? Map.of() : details;
        }
    }

    private final EventLog log;
    private final Clock clock;
    private final boolean enabled;

    public LifecycleLog(EventLog log, Clock clock, boolean enabled) {
        this.log = log;
        this.clock = clock;
        this.enabled = enabled;
    }

    public void append(EntityType type, String entityId, Event event, Map<String, Object> details) {
        if (!enabled) return;
        Log.debugf("Lifecycle %s %s:%s", event, type.key(), entityId);
        log.append(type.key(), new Entry(UUID.randomUUID().toString(), entityId, event, clock.instant(), details));
    }

    public List<Entry> entries(EntityType type) {
        return log.read(type.key(), Entry.class);
    }

    public List<Entry> entries(EntityType type, String entityId) {
        return entries(type).stream().filter(e -> entityId.equals(e.entityId())).toList();
    }
}
