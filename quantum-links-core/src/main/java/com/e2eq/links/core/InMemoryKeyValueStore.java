package com.e2eq.links.core;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local {@link KeyValueStore}. The default bean when no persistent store is deployed,
 * and the store unit tests run against.
 */
public class InMemoryKeyValueStore implements KeyValueStore {

    private final Map<String, String> values = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> sets = new ConcurrentHashMap<>();

    @Override
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    @Override
    public void set(String key, String value) {
        Objects.requireNonNull(value, "value");
        values.put(key, value);
    }

    @Override
    public boolean setIfAbsent(String key, String value) {
        Objects.requireNonNull(value, "value");
        return values.putIfAbsent(key, value) == null;
    }

    @Override
    public boolean delete(String key) {
        boolean removed = values.remove(key) != null;
        return sets.remove(key) != null || removed;
    }

    @Override
    public Map<String, String> mGet(List<String> keys) {
        Map<String, String> out = new LinkedHashMap<>();
        for (String k : keys) {
            String v = values.get(k);
            if (v != null) out.put(k, v);
        }
        return out;
    }

    @Override
    public boolean sAdd(String key, String member) {
        Set<String> set = sets.computeIfAbsent(key, k -> Collections.synchronizedSet(new LinkedHashSet<>()));
        return set.add(member);
    }

    @Override
    public boolean sRem(String key, String member) {
        Set<String> set = sets.get(key);
        if (set == null) return false;
        boolean removed = set.remove(member);
        if (set.isEmpty()) sets.remove(key, set);
        return removed;
    }

    @Override
    public List<String> sMembers(String key) {
        Set<String> set = sets.get(key);
        if (set == null) return List.of();
        synchronized (set) {
            return new ArrayList<>(set);
        }
    }

    @Override
    public List<String> keys(String prefix) {
        TreeSet<String> out = new TreeSet<>();
        for (String k : values.keySet()) if (k.startsWith(prefix)) out.add(k);
        for (String k : sets.keySet()) if (k.startsWith(prefix)) out.add(k);
        return new ArrayList<>(out);
    }

    public int size() {
        return values.size() + sets.size();
    }

    public void clear() {
        values.clear();
        sets.clear();
    }
}
