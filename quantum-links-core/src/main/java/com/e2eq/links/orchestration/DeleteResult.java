package com.e2eq.links.orchestration;

import com.e2eq.links.core.DecisionNeeded;
import com.e2eq.links.core.EntityRef;

import java.util.List;

/**
 * @param deleted   the root followed by cascaded entities, in deletion order
 * @param decisions prompts for linked entities that were left in place
 */
public record DeleteResult(EntityRef root, List<EntityRef> deleted, List<DecisionNeeded> decisions, int linksRemoved) {

    public DeleteResult {
        deleted = deleted == null ? List.of() : List.copyOf(deleted);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public boolean decisionNeeded() {
        return !decisions.isEmpty();
    }
}
