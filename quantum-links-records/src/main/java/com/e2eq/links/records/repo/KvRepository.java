package com.e2eq.links.records.repo;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.JsonCodec;
import com.e2eq.links.core.KeyValueStore;
import com.e2eq.links.core.KvKeys;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.exceptions.ValidationException;
import com.e2eq.links.orchestration.EntityRepository;

import java.util.*;

/**
 * Base repository storing one entity type as JSON under {@code data:{type}:{id}}, with the set
 * of all ids under {@code index:{type}:all}. Subclasses name their secondary indexes through
 * {@link #indexedFields}; index sets are kept in step on every upsert and delete.
 */
public abstract class KvRepository<T extends LinkableEntity> implements EntityRepository<T> {

    protected final KeyValueStore store;
    protected final JsonCodec codec;
    private final EntityType type;
    private final Class<T> modelClass;

    protected KvRepository(KeyValueStore store, JsonCodec codec, EntityType type, Class<T> modelClass) {
        this.store = store;
        this.codec = codec;
        this.type = type;
        this.modelClass = modelClass;
    }

    @Override
    public EntityType entityType() {
        return type;
    }

    @Override
    public Optional<T> get(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return store.get(KvKeys.entity(type, id)).map(json -> codec.read(json, modelClass));
    }

    @Override
    public T upsert(T entity) {
        if (entity.getId() == null || entity.getId().isBlank()) {
            throw new ValidationException(type.key() + " needs an id");
        }
        Map<String, String> before = get(entity.getId()).map(this::indexedFields).orElse(Map.of());
        store.set(KvKeys.entity(type, entity.getId()), codec.write(entity));
        store.sAdd(KvKeys.entityIds(type), entity.getId());
        Map<String, String> after = indexedFields(entity);
        before.forEach((field, value) -> {
            if (!value.equals(after.get(field))) {
                store.sRem(KvKeys.entityIndex(type, field, value), entity.getId());
            }
        });
        after.forEach((field, value) -> store.sAdd(KvKeys.entityIndex(type, field, value), entity.getId()));
        return entity;
    }

    @Override
    public void delete(String id) {
        Optional<T> existing = get(id);
        store.delete(KvKeys.entity(type, id));
        store.sRem(KvKeys.entityIds(type), id);
        existing.map(this::indexedFields).ifPresent(fields ->
                fields.forEach((field, value) -> store.sRem(KvKeys.entityIndex(type, field, value), id)));
    }

    public List<T> list() {
        return load(store.sMembers(KvKeys.entityIds(type)));
    }

    public boolean exists(String id) {
        return get(id).isPresent();
    }

    /** Entities whose {@code field} was {@code value} when last saved. */
    protected List<T> findBy(String field, String value) {
        if (value == null || value.isBlank()) return List.of();
        return load(store.sMembers(KvKeys.entityIndex(type, field, value)));
    }

    /** Secondary index values of an entity; blank values are not indexed. */
    protected Map<String, String> indexedFields(T entity) {
        return Map.of();
    }

    protected static void putIfPresent(Map<String, String> fields, String field, String value) {
        if (value != null && !value.isBlank()) fields.put(field, value);
    }

    private List<T> load(List<String> ids) {
        if (ids.isEmpty()) return List.of();
        List<String> keys = ids.stream().map(id -> KvKeys.entity(type, id)).toList();
        Map<String, String> found = store.mGet(keys);
        List<T> out = new ArrayList<>(found.size());
        for (String k : keys) {
            String json = found.get(k);
            if (json != null) out.add(codec.read(json, modelClass));
        }
        return out;
    }
}
