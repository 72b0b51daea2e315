package com.e2eq.links.core;

import java.util.Optional;

/**
 * Loads an entity by reference, whatever its type.
 */
@FunctionalInterface
public interface EntityResolver {

    Optional<LinkableEntity> resolve(EntityRef ref);
}
