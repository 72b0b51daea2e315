package com.e2eq.links.exceptions;

import com.e2eq.links.core.EntityRef;

/**
 * The entity was persisted but a later workflow or link step failed. The saved entity is
 * carried so callers can report the partial success and retry; every side effect is an
 * idempotent upsert, so a retry converges.
 */
public class SideEffectsIncompleteException extends LinkEngineException {
    private static final long serialVersionUID = 1L;

    private final EntityRef entity;
    private final transient Object savedEntity;

    public SideEffectsIncompleteException(EntityRef entity, Object savedEntity, Throwable cause) {
        super(String.format("%s was saved, but side effects are incomplete: %s", entity.key(), cause.getMessage()), cause);
        this.entity = entity;
        this.savedEntity = savedEntity;
    }

    public EntityRef getEntity() {
        return entity;
    }

    public Object getSavedEntity() {
        return savedEntity;
    }
}
