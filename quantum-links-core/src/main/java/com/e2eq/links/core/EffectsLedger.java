package com.e2eq.links.core;

import io.quarkus.logging.Log;

import java.util.List;

/**
 * Idempotency flags for cross-entity side effects, stored under {@code effects:{effectKey}}.
 *
 * <p>The default contract is check, act, mark: a workflow calls {@link #hasEffect}, performs the
 * side effect when the key is unmarked, then calls {@link #markEffect}. The sequence is not atomic,
 * so two concurrent callers can both act. Every side effect performed this way is an upsert keyed
 * by a deterministic id (for example {@code item-{taskId}-completion}) and converges to one record.
 * That gives at-most-once for sequential callers and convergent at-least-once for concurrent ones.</p>
 *
 * <p>{@link #tryMarkEffect} is the claim-first alternative built on
 * {@link KeyValueStore#setIfAbsent}. A caller that claims and then fails must
 * {@link #clearEffect} to release the claim.</p>
 */
public class EffectsLedger {

    static final String MARKED = "true";

    private final KeyValueStore store;

    public EffectsLedger(KeyValueStore store) {
        this.store = store;
    }

    public boolean hasEffect(String effectKey) {
        return store.get(KvKeys.effect(effectKey)).isPresent();
    }

    public void markEffect(String effectKey) {
        store.set(KvKeys.effect(effectKey), MARKED);
        Log.debugf("Effect marked: %s", effectKey);
    }

    /**
     * Marks the key only if nobody has marked it yet.
     * @return true if this call claimed the effect
     */
    public boolean tryMarkEffect(String effectKey) {
        boolean claimed = store.setIfAbsent(KvKeys.effect(effectKey), MARKED);
        Log.debugf("Effect claim %s: %s", claimed ? "won" : "lost", effectKey);
        return claimed;
    }

    public void clearEffect(String effectKey) {
        if (store.delete(KvKeys.effect(effectKey))) {
            Log.debugf("Effect cleared: %s", effectKey);
        }
    }

    /**
     * Clears every effect of one entity whose kind starts with {@code kindPrefix}; an empty prefix
     * clears all of the entity's effects.
     * @return the number of keys cleared
     */
    public int clearEffectsByPrefix(String entity, String id, String kindPrefix) {
        String scan = KvKeys.effect(EffectKeys.prefix(entity, id) + (kindPrefix == null ? "" : kindPrefix));
        List<String> keys = store.keys(scan);
        int cleared = 0;
        for (String k : keys) {
            if (store.delete(k)) cleared++;
        }
        if (cleared > 0) {
            Log.debugf("Cleared %d effect(s) under %s", cleared, scan);
        }
        return cleared;
    }

    /** Effect keys currently marked for one entity, without the storage prefix. */
    public List<String> effectsOf(String entity, String id) {
        return store.keys(KvKeys.effect(EffectKeys.prefix(entity, id))).stream()
                .map(k -> k.substring(KvKeys.EFFECT_PREFIX.length()))
                .toList();
    }
}
