package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.exceptions.ValidationException;
import io.quarkus.logging.Log;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workflow handlers keyed by entity type. Filled at process start so the orchestrator only
 * depends on {@link WorkflowHandler}.
 */
public class WorkflowHandlerRegistry {

    private final Map<EntityType, WorkflowHandler<?>> handlers = new ConcurrentHashMap<>();

    public void register(WorkflowHandler<?> handler) {
        WorkflowHandler<?> existing = handlers.putIfAbsent(handler.entityType(), handler);
        if (existing != null && existing != handler) {
            throw new ValidationException("A workflow handler for " + handler.entityType().key() + " is already registered");
        }
        Log.debugf("Workflow handler registered for %s: %s", handler.entityType().key(), handler.getClass().getSimpleName());
    }

    @SuppressWarnings("unchecked")
    public <T extends LinkableEntity> Optional<WorkflowHandler<T>> handlerFor(EntityType type) {
        return Optional.ofNullable((WorkflowHandler<T>) handlers.get(type));
    }
}
