package com.e2eq.links.orchestration;

import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.EntityResolver;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.exceptions.ValidationException;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Repositories keyed by entity type, registered at startup.
 */
public class RepositoryRegistry implements EntityResolver {

    private final Map<EntityType, EntityRepository<?>> repositories = new ConcurrentHashMap<>();

    public void register(EntityRepository<?> repository) {
        EntityRepository<?> existing = repositories.putIfAbsent(repository.entityType(), repository);
        if (existing != null && existing != repository) {
            throw new ValidationException("A repository for " + repository.entityType().key() + " is already registered");
        }
    }

    public EntityRepository<?> require(EntityType type) {
        EntityRepository<?> repo = repositories.get(type);
        if (repo == null) {
            throw new ValidationException("No repository registered for " + type.key());
        }
        return repo;
    }

    @Override
    public Optional<LinkableEntity> resolve(EntityRef ref) {
        EntityRepository<?> repo = repositories.get(ref.type());
        if (repo == null) return Optional.empty();
        return repo.get(ref.id()).map(LinkableEntity.class::cast);
    }
}
