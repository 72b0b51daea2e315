package com.e2eq.links.core;

import java.util.List;

public record UpdateOutcome(List<TriggerResult> propagated, List<DecisionNeeded> decisions) {

    public UpdateOutcome {
        propagated = propagated == null ? List.of() : List.copyOf(propagated);
        decisions = decisions == null ? List.of() : List.copyOf(decisions);
    }

    public static UpdateOutcome none() {
        return new UpdateOutcome(List.of(), List.of());
    }
}
