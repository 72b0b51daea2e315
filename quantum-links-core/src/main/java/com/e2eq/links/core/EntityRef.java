package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;

/**
 * Opaque reference to any linkable entity. Equality is structural.
 */
public record EntityRef(EntityType type, String id) {

    public static EntityRef of(EntityType type, String id) {
        if (type == null) {
            throw new ValidationException("EntityRef type must not be null");
        }
        if (id == null || id.isBlank()) {
            throw new ValidationException("EntityRef id must not be blank for type " + type.key());
        }
        return new EntityRef(type, id);
    }

    /** {@code "{type}:{id}"}, the form used by the processing guard and in messages. */
    public String key() {
        return type.key() + ":" + id;
    }

    @Override
    public String toString() {
        return key();
    }
}
