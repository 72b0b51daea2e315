package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;

/**
 * Per entity type workflow, run by the orchestrator after the entity is persisted.
 * Implementations use the effects ledger and the trigger evaluator for cross-entity effects.
 */
public interface WorkflowHandler<T extends LinkableEntity> {

    EntityType entityType();

    /** @param previous the stored version before this save, null on creation */
    void onUpsert(T saved, T previous);

    /** Cleanup after the entity is removed from its repository and before its links are removed. */
    void onDelete(T entity);
}
