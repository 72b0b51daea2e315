package com.e2eq.links.orchestration;

/**
 * @param skipWorkflowEffects skip the workflow handler and update propagation
 * @param skipLinkEffects     skip link reconciliation
 */
public record UpsertOptions(boolean skipWorkflowEffects, boolean skipLinkEffects) {

    public static UpsertOptions defaults() {
        return new UpsertOptions(false, false);
    }

    public static UpsertOptions skipWorkflow() {
        return new UpsertOptions(true, false);
    }
}
