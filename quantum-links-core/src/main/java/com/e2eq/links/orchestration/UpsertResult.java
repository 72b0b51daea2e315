package com.e2eq.links.orchestration;

import com.e2eq.links.core.DecisionNeeded;
import com.e2eq.links.core.LinkableEntity;

import java.util.List;

public record UpsertResult<T extends LinkableEntity>(T saved, List<DecisionNeeded> decisions, ReconcileResult links) {

    public UpsertResult {
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
        links = links == null ? ReconcileResult.SKIPPED : links;
    }
}
