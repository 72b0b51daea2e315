package com.e2eq.links.core;

import java.time.Instant;

/**
 * One entry of the processing guard's stack; {@code key} is {@code "{type}:{id}"}.
 */
public record ProcessingStackItem(String key, Instant startedAt) {
}
