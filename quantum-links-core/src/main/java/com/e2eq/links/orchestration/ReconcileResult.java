package com.e2eq.links.orchestration;

public record ReconcileResult(int created, int updated, int removed) {

    public static final ReconcileResult SKIPPED = new ReconcileResult(0, 0, 0);

    public boolean changed() {
        return created + updated + removed > 0;
    }
}
