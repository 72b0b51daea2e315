package com.e2eq.links.core;

import com.e2eq.links.exceptions.CircularReferenceException;
import com.e2eq.links.exceptions.DepthExceededException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.quarkus.logging.Log;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Call-depth and cycle detector for workflow propagation. The stack lives in the
 * {@link KeyValueStore} under {@code processing:stack}, so invocations that do not share a
 * process still see the same view. Entries older than the timeout are evicted lazily by the
 * next {@link #startProcessing}.
 *
 * <p>Updates are read-modify-write without a transaction; concurrent requests can lose an
 * update. Staleness eviction bounds the damage.</p>
 */
public class ProcessingGuard {

    public static final int DEFAULT_MAX_DEPTH = 5;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    private static final TypeReference<List<ProcessingStackItem>> STACK_TYPE = new TypeReference<>() { };

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final Clock clock;
    private final int maxDepth;
    private final Duration timeout;

    public ProcessingGuard(KeyValueStore store, JsonCodec codec, Clock clock, int maxDepth, Duration timeout) {
        if (maxDepth < 1) throw new IllegalArgumentException("maxDepth must be >= 1");
        this.store = store;
        this.codec = codec;
        this.clock = clock;
        this.maxDepth = maxDepth;
        this.timeout = timeout;
    }

    public ProcessingGuard(KeyValueStore store, JsonCodec codec, Clock clock) {
        this(store, codec, clock, DEFAULT_MAX_DEPTH, DEFAULT_TIMEOUT);
    }

    public static String key(EntityType type, String id) {
        return type.key() + ":" + id;
    }

    public void startProcessing(EntityType type, String id) {
        String key = key(type, id);
        Instant now = clock.instant();
        List<ProcessingStackItem> stack = read();
        int before = stack.size();
        stack.removeIf(item -> Duration.between(item.startedAt(), now).compareTo(timeout) > 0);
        if (stack.size() != before) {
            Log.debugf("Processing guard evicted %d stale entries", before - stack.size());
            write(stack);
        }
        List<String> keys = stack.stream().map(ProcessingStackItem::key).toList();
        if (keys.contains(key)) {
            throw new CircularReferenceException(key, keys);
        }
        if (stack.size() >= maxDepth) {
            throw new DepthExceededException(key, maxDepth, keys);
        }
        stack.add(new ProcessingStackItem(key, now));
        write(stack);
        Log.debugf("Processing started: %s (depth %d)", key, stack.size());
    }

    /** Removes the key wherever it sits; branches may finish out of order. */
    public void endProcessing(EntityType type, String id) {
        String key = key(type, id);
        List<ProcessingStackItem> stack = read();
        if (stack.removeIf(item -> item.key().equals(key))) {
            write(stack);
            Log.debugf("Processing ended: %s (depth %d)", key, stack.size());
        }
    }

    public boolean isProcessing(EntityType type, String id) {
        String key = key(type, id);
        return read().stream().anyMatch(item -> item.key().equals(key));
    }

    public ProcessingStatus getProcessingStatus() {
        return new ProcessingStatus(read(), maxDepth, timeout);
    }

    public void clearProcessingStack() {
        store.delete(KvKeys.PROCESSING_STACK);
        Log.info("Processing stack cleared");
    }

    public int maxDepth() {
        return maxDepth;
    }

    private List<ProcessingStackItem> read() {
        return store.get(KvKeys.PROCESSING_STACK)
                .map(json -> new ArrayList<>(codec.read(json, STACK_TYPE)))
                .orElseGet(ArrayList::new);
    }

    private void write(List<ProcessingStackItem> stack) {
        if (stack.isEmpty()) {
            store.delete(KvKeys.PROCESSING_STACK);
        } else {
            store.set(KvKeys.PROCESSING_STACK, codec.write(stack));
        }
    }
}
