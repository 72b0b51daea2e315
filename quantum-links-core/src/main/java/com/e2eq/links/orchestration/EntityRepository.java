package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;

import java.util.Optional;

/**
 * Persistence contract for one entity type.
 */
public interface EntityRepository<T extends LinkableEntity> {

    EntityType entityType();

    Optional<T> get(String id);

    T upsert(T entity);

    void delete(String id);
}
