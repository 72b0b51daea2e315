package com.e2eq.links.records.workflow;

import com.e2eq.links.core.EffectKeys;
import com.e2eq.links.core.EffectsLedger;
import com.e2eq.links.core.LifecycleEvent;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.core.TriggerContext;
import com.e2eq.links.core.TriggerEvaluator;
import com.e2eq.links.core.TriggerResult;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * Fires {@code complete} directional rules for a finished record, once per effect kind.
 */
@Singleton
public class CompletionEffects {

    private final EffectsLedger ledger;
    private final TriggerEvaluator triggers;

    @Inject
    public CompletionEffects(EffectsLedger ledger, TriggerEvaluator triggers) {
        this.ledger = ledger;
        this.triggers = triggers;
    }

    /**
     * Check, act, mark: evaluates the {@code complete} rules of {@code linkType} unless
     * {@code {type}:{id}:{kind}} is already marked, and marks it when a rule fired.
     *
     * @return true if the effect was applied by this call
     */
    public boolean completeOnce(LinkableEntity subject, LinkType linkType, String kind) {
        String key = EffectKeys.sideEffect(subject.ref(), kind);
        if (ledger.hasEffect(key)) {
            Log.debugf("Effect %s already applied", key);
            return false;
        }
        TriggerResult result = complete(subject, linkType);
        if (!result.triggered()) {
            return false;
        }
        ledger.markEffect(key);
        return true;
    }

    /** Evaluates the {@code complete} rules without consulting the ledger. */
    public TriggerResult complete(LinkableEntity subject, LinkType linkType) {
        return triggers.evaluate(linkType, LifecycleEvent.COMPLETE, TriggerContext.of(subject));
    }

    public EffectsLedger ledger() {
        return ledger;
    }
}
