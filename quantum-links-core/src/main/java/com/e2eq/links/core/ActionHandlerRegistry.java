package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;
import io.quarkus.logging.Log;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Action handlers keyed by the entity type they act on. Populated at startup.
 */
public class ActionHandlerRegistry {

    private final Map<EntityType, ActionHandler> handlers = new ConcurrentHashMap<>();

    public void register(ActionHandler handler) {
        ActionHandler existing = handlers.putIfAbsent(handler.entityType(), handler);
        if (existing != null && existing != handler) {
            throw new ValidationException("An action handler for " + handler.entityType().key()
                    + " is already registered: " + existing.getClass().getName());
        }
        Log.debugf("Action handler registered for %s: %s", handler.entityType().key(), handler.getClass().getSimpleName());
    }

    public Optional<ActionHandler> handlerFor(EntityType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public boolean isRegistered(EntityType type) {
        return handlers.containsKey(type);
    }
}
