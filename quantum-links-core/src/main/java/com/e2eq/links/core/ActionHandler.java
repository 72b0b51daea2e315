package com.e2eq.links.core;

/**
 * Owns the business logic of acting on one entity type: how an item is built from a task, how
 * a player is credited, and so on. The trigger evaluator only routes.
 */
public interface ActionHandler {

    /** The entity type this handler creates or updates. */
    EntityType entityType();

    void handle(ActionRequest request);
}
