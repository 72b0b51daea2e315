package com.e2eq.links.records.workflow;

import com.e2eq.links.core.EffectKeys;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.orchestration.WorkflowHandler;
import com.e2eq.links.records.model.RecordStatus;
import com.e2eq.links.records.model.Sale;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

/**
 * A {@code Done} sale books one financial record and marks its customer active.
 */
@Singleton
public class SaleWorkflow implements WorkflowHandler<Sale> {

    private final CompletionEffects completion;

    @Inject
    public SaleWorkflow(CompletionEffects completion) {
        this.completion = completion;
    }

    @Override
    public EntityType entityType() {
        return EntityType.SALE;
    }

    @Override
    public void onUpsert(Sale saved, Sale previous) {
        if (!RecordStatus.isDone(saved.getStatus())) return;
        completion.completeOnce(saved, LinkType.SALE_FINREC, EffectKeys.FINANCIAL_CREATED);
        if (RecordStatus.becameDone(saved.getStatus(), previous != null ? previous.getStatus() : null)) {
            completion.complete(saved, LinkType.SALE_CHARACTER);
        }
    }

    @Override
    public void onDelete(Sale sale) {
        completion.ledger().clearEffectsByPrefix(EntityType.SALE.key(), sale.getId(), "");
    }
}
