package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;

import java.util.Locale;
import java.util.Optional;

/**
 * Typed, directed relationships. Each type fixes the entity type of both ends, which makes the
 * enum itself the compatibility matrix used when validating links.
 */
public enum LinkType {
    TASK_ITEM(EntityType.TASK, EntityType.ITEM),
    TASK_FINREC(EntityType.TASK, EntityType.FINANCIAL),
    TASK_SALE(EntityType.TASK, EntityType.SALE),
    TASK_PLAYER(EntityType.TASK, EntityType.PLAYER),
    TASK_CHARACTER(EntityType.TASK, EntityType.CHARACTER),
    TASK_SITE(EntityType.TASK, EntityType.SITE),

    ITEM_TASK(EntityType.ITEM, EntityType.TASK),
    ITEM_SALE(EntityType.ITEM, EntityType.SALE),
    ITEM_FINREC(EntityType.ITEM, EntityType.FINANCIAL),
    ITEM_PLAYER(EntityType.ITEM, EntityType.PLAYER),
    ITEM_CHARACTER(EntityType.ITEM, EntityType.CHARACTER),
    ITEM_SITE(EntityType.ITEM, EntityType.SITE),

    SALE_TASK(EntityType.SALE, EntityType.TASK),
    SALE_ITEM(EntityType.SALE, EntityType.ITEM),
    SALE_FINREC(EntityType.SALE, EntityType.FINANCIAL),
    SALE_PLAYER(EntityType.SALE, EntityType.PLAYER),
    SALE_CHARACTER(EntityType.SALE, EntityType.CHARACTER),
    SALE_SITE(EntityType.SALE, EntityType.SITE),

    FINREC_TASK(EntityType.FINANCIAL, EntityType.TASK),
    FINREC_ITEM(EntityType.FINANCIAL, EntityType.ITEM),
    FINREC_SALE(EntityType.FINANCIAL, EntityType.SALE),
    FINREC_PLAYER(EntityType.FINANCIAL, EntityType.PLAYER),
    FINREC_CHARACTER(EntityType.FINANCIAL, EntityType.CHARACTER),
    FINREC_SITE(EntityType.FINANCIAL, EntityType.SITE),

    CHARACTER_TASK(EntityType.CHARACTER, EntityType.TASK),
    CHARACTER_ITEM(EntityType.CHARACTER, EntityType.ITEM),
    CHARACTER_SALE(EntityType.CHARACTER, EntityType.SALE),
    CHARACTER_FINREC(EntityType.CHARACTER, EntityType.FINANCIAL),
    CHARACTER_SITE(EntityType.CHARACTER, EntityType.SITE),
    CHARACTER_PLAYER(EntityType.CHARACTER, EntityType.PLAYER),

    SITE_TASK(EntityType.SITE, EntityType.TASK),
    SITE_ITEM(EntityType.SITE, EntityType.ITEM),
    SITE_SALE(EntityType.SITE, EntityType.SALE),
    SITE_FINREC(EntityType.SITE, EntityType.FINANCIAL),
    SITE_CHARACTER(EntityType.SITE, EntityType.CHARACTER),
    SITE_SITE(EntityType.SITE, EntityType.SITE),

    PLAYER_TASK(EntityType.PLAYER, EntityType.TASK),
    PLAYER_ITEM(EntityType.PLAYER, EntityType.ITEM),
    PLAYER_SALE(EntityType.PLAYER, EntityType.SALE),
    PLAYER_FINREC(EntityType.PLAYER, EntityType.FINANCIAL),
    PLAYER_CHARACTER(EntityType.PLAYER, EntityType.CHARACTER);

    private final EntityType sourceType;
    private final EntityType targetType;

    LinkType(EntityType sourceType, EntityType targetType) {
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    public EntityType sourceType() {
        return sourceType;
    }

    public EntityType targetType() {
        return targetType;
    }

    /** The paired type with swapped ends ({@code TASK_ITEM} to {@code ITEM_TASK}). */
    public LinkType reverse() {
        return between(targetType, sourceType).orElseThrow();
    }

    public static Optional<LinkType> between(EntityType source, EntityType target) {
        for (LinkType t : values()) {
            if (t.sourceType == source && t.targetType == target) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public static LinkType parse(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Link type must not be blank");
        }
        try {
            return LinkType.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new ValidationException("Unknown link type '" + value + "'");
        }
    }
}
