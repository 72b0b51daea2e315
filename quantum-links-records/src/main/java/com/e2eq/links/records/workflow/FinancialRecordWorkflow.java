package com.e2eq.links.records.workflow;

import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.orchestration.WorkflowHandler;
import com.e2eq.links.records.model.FinancialRecord;
import com.e2eq.links.records.model.RecordStatus;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

@Singleton
public class FinancialRecordWorkflow implements WorkflowHandler<FinancialRecord> {

    private final CompletionEffects completion;

    @Inject
    public FinancialRecordWorkflow(CompletionEffects completion) {
        this.completion = completion;
    }

    @Override
    public EntityType entityType() {
        return EntityType.FINANCIAL;
    }

    @Override
    public void onUpsert(FinancialRecord saved, FinancialRecord previous) {
        if (RecordStatus.becameDone(saved.getStatus(), previous != null ? previous.getStatus() : null)) {
            completion.complete(saved, LinkType.FINREC_CHARACTER);
        }
    }

    @Override
    public void onDelete(FinancialRecord record) {
        completion.ledger().clearEffectsByPrefix(EntityType.FINANCIAL.key(), record.getId(), "");
    }
}
