package com.e2eq.links.core;

import java.time.Duration;
import java.util.List;

public record ProcessingStatus(List<ProcessingStackItem> stack, int maxDepth, Duration timeout) {

    public ProcessingStatus {
        stack = stack == null ? List.of() : List.copyOf(stack);
    }

    public int depth() {
        return stack.size();
    }

    public boolean processing() {
        return !stack.isEmpty();
    }
}
