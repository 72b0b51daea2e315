package com.e2eq.links.core;

import java.util.Map;

/**
 * Implemented by every record that takes part in links. The non-getter method names keep these
 * out of the entity's JSON form.
 */
public interface LinkableEntity {

    String getId();

    EntityType entityType();

    /** Current lifecycle status, compared by {@code sourceStatus}/{@code targetStatus} conditions. */
    default String lifecycleStatus() {
        return null;
    }

    /** Flags matched by {@code metadata} conditions. */
    default Map<String, Object> triggerMetadata() {
        return Map.of();
    }

    default EntityRef ref() {
        return EntityRef.of(entityType(), getId());
    }
}
