package com.e2eq.links.records.model;

import com.e2eq.links.orchestration.EntityOrchestrator;

/**
 * Status values shared by the business records. Statuses are free text; these are the ones the
 * workflows react to.
 */
public final class RecordStatus {

    public static final String CREATED = "Created";
    public static final String IN_PROGRESS = "In Progress";
    public static final String DONE = EntityOrchestrator.STATUS_DONE;
    public static final String COLLECTED = EntityOrchestrator.STATUS_COLLECTED;
    public static final String PENDING = "Pending";
    public static final String CANCELLED = "Cancelled";
    public static final String IN_STOCK = "In Stock";

    private RecordStatus() { }

    public static boolean isDone(String status) {
        return DONE.equals(status);
    }

    /** True when the status moved into {@code Done} with this save. */
    public static boolean becameDone(String current, String previous) {
        return isDone(current) && !isDone(previous);
    }
}
