package com.e2eq.links.core;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The generic store everything in the link engine persists to. Values are opaque strings
 * (JSON in practice). There are no multi-key transactions.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value);

    /**
     * Writes only when the key is absent.
     * @return true if this call wrote the value
     */
    boolean setIfAbsent(String key, String value);

    /** @return true if a value was removed */
    boolean delete(String key);

    /** Values for the keys that exist, in the order requested. Missing keys are omitted. */
    Map<String, String> mGet(List<String> keys);

    // Sets. Members are returned in insertion order.
    boolean sAdd(String key, String member);

    boolean sRem(String key, String member);

    List<String> sMembers(String key);

    /** Scalar and set keys starting with {@code prefix}, sorted. */
    List<String> keys(String prefix);
}
