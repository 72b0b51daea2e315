package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;

import java.time.YearMonth;
import java.time.format.DateTimeFormatter;

/**
 * Builds effect keys for the {@link EffectsLedger}. The grammar is a stable storage contract:
 * <pre>
 *   created     {entity}:{id}:created
 *   status      {entity}:{id}:status:{from}->{to}[:{bucket}]
 *   side effect {entity}:{id}:{kind}
 *   monthly     {entity}:{id}:{kind}:{yyyymm}
 * </pre>
 */
public final class EffectKeys {

    public static final String ITEM_CREATED = "itemCreated";
    public static final String FINANCIAL_CREATED = "financialCreated";
    public static final String POINTS_AWARDED = "pointsAwarded";
    public static final String CHARACTER_CREATED = "characterCreated";

    private static final DateTimeFormatter YYYYMM = DateTimeFormatter.ofPattern("yyyyMM");

    private EffectKeys() { }

    public static String created(String entity, String id) {
        return prefix(entity, id) + "created";
    }

    public static String status(String entity, String id, String from, String to) {
        return status(entity, id, from, to, null);
    }

    public static String status(String entity, String id, String from, String to, String bucket) {
        requireText(from, "from");
        requireText(to, "to");
        String key = prefix(entity, id) + "status:" + from + "->" + to;
        return bucket == null || bucket.isBlank() ? key : key + ":" + bucket;
    }

    public static String sideEffect(String entity, String id, String kind) {
        requireText(kind, "kind");
        return prefix(entity, id) + kind;
    }

    public static String monthly(String entity, String id, String kind, String yyyymm) {
        requireText(kind, "kind");
        if (yyyymm == null || !yyyymm.matches("\\d{6}")) {
            throw new ValidationException("Monthly bucket must be yyyymm, got '" + yyyymm + "'");
        }
        return prefix(entity, id) + kind + ":" + yyyymm;
    }

    public static String monthly(String entity, String id, String kind, YearMonth month) {
        return monthly(entity, id, kind, month.format(YYYYMM));
    }

    // Typed conveniences
    public static String created(EntityRef ref) {
        return created(ref.type().key(), ref.id());
    }

    public static String sideEffect(EntityRef ref, String kind) {
        return sideEffect(ref.type().key(), ref.id(), kind);
    }

    /** {@code "{entity}:{id}:"}, the common prefix of every key of one entity. */
    public static String prefix(String entity, String id) {
        requireText(entity, "entity");
        requireText(id, "id");
        return entity + ":" + id + ":";
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Effect key part '" + name + "' must not be blank");
        }
    }
}
