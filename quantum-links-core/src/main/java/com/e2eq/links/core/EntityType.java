package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

/**
 * Kinds of business records that can take part in links.
 */
public enum EntityType {
    TASK("task"),
    ITEM("item"),
    SALE("sale"),
    FINANCIAL("financial"),
    CHARACTER("character"),
    SITE("site"),
    PLAYER("player");

    private final String key;

    EntityType(String key) {
        this.key = key;
    }

    /** Lower-case form used in storage keys, effect keys and JSON. */
    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static EntityType fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Entity type must not be blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (EntityType t : values()) {
            if (t.key.equals(normalized)) {
                return t;
            }
        }
        throw new ValidationException("Unknown entity type '" + value + "'. Expected one of: " + Arrays.toString(values()));
    }
}
