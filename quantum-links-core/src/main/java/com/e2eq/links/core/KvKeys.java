package com.e2eq.links.core;

/**
 * Key layout of the link engine inside the {@link KeyValueStore}.
 */
public final class KvKeys {

    public static final String LINK_PREFIX = "links:link:";
    public static final String BY_ENTITY_PREFIX = "index:links:by-entity:";
    public static final String BY_TYPE_PREFIX = "index:links:by-type:";
    public static final String EFFECT_PREFIX = "effects:";
    public static final String LOG_PREFIX = "logs:";
    public static final String PROCESSING_STACK = "processing:stack";

    private KvKeys() { }

    public static String link(String id) {
        return LINK_PREFIX + id;
    }

    public static String byEntity(EntityRef ref) {
        return BY_ENTITY_PREFIX + ref.type().key() + ":" + ref.id();
    }

    /** One key per link, so the type index never becomes a single growing record. */
    public static String byType(LinkType linkType, String linkId) {
        return byTypePrefix(linkType) + linkId;
    }

    public static String byTypePrefix(LinkType linkType) {
        return BY_TYPE_PREFIX + linkType.name() + ":";
    }

    public static String effect(String effectKey) {
        return EFFECT_PREFIX + effectKey;
    }

    public static String logEntry(String name, String sequence) {
        return logPrefix(name) + sequence;
    }

    public static String logPrefix(String name) {
        return LOG_PREFIX + name + ":";
    }

    /** Primary key of an entity record, used by the key-value repositories. */
    public static String entity(EntityType type, String id) {
        return "data:" + type.key() + ":" + id;
    }

    /** Set of all ids of one entity type. */
    public static String entityIds(EntityType type) {
        return "index:" + type.key() + ":all";
    }

    /** Secondary index of one entity type, e.g. {@code index:item:sourceTaskId:task-1}. */
    public static String entityIndex(EntityType type, String field, String value) {
        return "index:" + type.key() + ":" + field + ":" + value;
    }
}
