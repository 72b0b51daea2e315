package com.e2eq.links.core;

import java.util.List;

/**
 * Everything a delete will do, computed before anything is mutated.
 *
 * @param cascades  entities to delete after the root, breadth-first, each reached through {@code link}
 * @param decisions prompts for counterparts that are left in place
 */
public record DeletePlan(EntityRef root, List<CascadeStep> cascades, List<DecisionNeeded> decisions) {

    public record CascadeStep(EntityRef from, EntityRef target, Link link, int depth) { }

    public DeletePlan {
        cascades = cascades == null ? List.of() : List.copyOf(cascades);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public List<EntityRef> cascadeTargets() {
        return cascades.stream().map(CascadeStep::target).toList();
    }
}
