package com.e2eq.links.core;

import io.quarkus.logging.Log;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Append-only JSON logs. Every entry is its own key,
 * {@code logs:{name}:{epochMillis}-{counter}-{uuid}}, so no record grows with the log and a
 * prefix scan returns entries in append order.
 * Appending is best effort: a failure is logged at WARN and never reaches the caller.
 */
public class EventLog {

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final Clock clock;
    private final AtomicLong counter = new AtomicLong();

    public EventLog(KeyValueStore store, JsonCodec codec) {
        this(store, codec, Clock.systemUTC());
    }

    public EventLog(KeyValueStore store, JsonCodec codec, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.clock = clock;
    }

    public void append(String name, Object entry) {
        try {
            store.set(KvKeys.logEntry(name, nextSequence()), codec.write(entry));
        } catch (RuntimeException e) {
            Log.warnf(e, "Unable to append to log '%s'; continuing", name);
        }
    }

    public <T> List<T> read(String name, Class<T> type) {
        List<String> keys = store.keys(KvKeys.logPrefix(name));
        if (keys.isEmpty()) return List.of();
        Map<String, String> found = store.mGet(keys);
        List<T> out = new ArrayList<>(keys.size());
        for (String k : keys) {
            String json = found.get(k);
            if (json != null) out.add(codec.read(json, type));
        }
        return out;
    }

    // fixed-width fields keep lexical key order equal to append order
    String nextSequence() {
        return String.format("%013d-%012d-%s", clock.millis(), counter.incrementAndGet(), UUID.randomUUID());
    }
}
