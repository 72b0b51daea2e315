package com.e2eq.links.records.workflow;

import com.e2eq.links.core.EffectKeys;
import com.e2eq.links.core.EffectsLedger;
import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.orchestration.EntityOrchestrator;
import com.e2eq.links.orchestration.UpsertOptions;
import com.e2eq.links.orchestration.WorkflowHandler;
import com.e2eq.links.records.actions.PlayerActionHandler;
import com.e2eq.links.records.model.CharacterRecord;
import com.e2eq.links.records.model.FinancialRecord;
import com.e2eq.links.records.model.Item;
import com.e2eq.links.records.model.RecordStatus;
import com.e2eq.links.records.model.Task;
import com.e2eq.links.records.repo.FinancialRecordRepo;
import com.e2eq.links.records.repo.ItemRepo;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.util.ArrayList;
import java.util.List;

/**
 * Task side effects.
 * <ul>
 *   <li>A new-customer name without a character id creates the customer character once.</li>
 *   <li>A {@code Done} task produces its item, financial record and reward points, each once.</li>
 *   <li>Leaving {@code Done} for anything but {@code Collected} undoes those three.</li>
 * </ul>
 * Output field changes on a done task reach the item and financial record through the
 * {@code propagate} update policies, not through this handler.
 */
@Singleton
public class TaskWorkflow implements WorkflowHandler<Task> {

    private final EntityOrchestrator orchestrator;
    private final CompletionEffects completion;
    private final ItemRepo items;
    private final FinancialRecordRepo financials;
    private final PlayerActionHandler players;

    @Inject
    public TaskWorkflow(EntityOrchestrator orchestrator, CompletionEffects completion, ItemRepo items,
                        FinancialRecordRepo financials, PlayerActionHandler players) {
        this.orchestrator = orchestrator;
        this.completion = completion;
        this.items = items;
        this.financials = financials;
        this.players = players;
    }

    @Override
    public EntityType entityType() {
        return EntityType.TASK;
    }

    @Override
    public void onUpsert(Task saved, Task previous) {
        ensureCustomerCharacter(saved);
        String before = previous != null ? previous.getStatus() : null;
        if (RecordStatus.isDone(saved.getStatus())) {
            if (RecordStatus.isDone(before)) {
                releaseCreditOnPlayerChange(saved, previous);
            }
            completion.completeOnce(saved, LinkType.TASK_ITEM, EffectKeys.ITEM_CREATED);
            completion.completeOnce(saved, LinkType.TASK_FINREC, EffectKeys.FINANCIAL_CREATED);
            completion.completeOnce(saved, LinkType.TASK_PLAYER, EffectKeys.POINTS_AWARDED);
            if (RecordStatus.becameDone(saved.getStatus(), before)) {
                completion.complete(saved, LinkType.TASK_CHARACTER);
            }
        } else if (RecordStatus.isDone(before) && !RecordStatus.COLLECTED.equals(saved.getStatus())) {
            uncomplete(saved, previous);
        }
    }

    @Override
    public void onDelete(Task task) {
        int cleared = completion.ledger().clearEffectsByPrefix(EntityType.TASK.key(), task.getId(), "");
        Log.debugf("Task %s deleted, %d effect(s) cleared", task.getId(), cleared);
    }

    private void ensureCustomerCharacter(Task saved) {
        String name = saved.getNewCustomerName();
        if (name == null || name.isBlank()) return;
        if (saved.getCustomerCharacterId() != null && !saved.getCustomerCharacterId().isBlank()) return;
        EffectsLedger ledger = completion.ledger();
        String key = EffectKeys.sideEffect(saved.ref(), EffectKeys.CHARACTER_CREATED);
        if (ledger.hasEffect(key)) return;

        List<String> roles = new ArrayList<>();
        roles.add(CharacterRecord.ROLE_CUSTOMER);
        CharacterRecord customer = CharacterRecord.builder()
                .id(CharacterRecord.customerOf(saved.getId()))
                .name(name.trim())
                .roles(roles)
                .siteId(saved.getSiteId())
                .build();
        orchestrator.upsert(customer);
        ledger.markEffect(key);

        saved.setCustomerCharacterId(customer.getId());
        orchestrator.upsert(saved, UpsertOptions.skipWorkflow());
        Log.infof("Customer %s created for task %s", customer.getId(), saved.getId());
    }

    // the next completeOnce credits the new player
    private void releaseCreditOnPlayerChange(Task saved, Task previous) {
        String from = previous.getPlayerId();
        if (from == null || from.equals(saved.getPlayerId())) return;
        players.revokeCredit(from, saved.getId());
        completion.ledger().clearEffect(EffectKeys.sideEffect(saved.ref(), EffectKeys.POINTS_AWARDED));
    }

    private void uncomplete(Task saved, Task previous) {
        EntityRef ref = saved.ref();
        EffectsLedger ledger = completion.ledger();
        for (Item item : items.findBySourceTask(saved.getId())) {
            orchestrator.remove(EntityType.ITEM, item.getId());
        }
        for (FinancialRecord record : financials.findBySourceTask(saved.getId())) {
            orchestrator.remove(EntityType.FINANCIAL, record.getId());
        }
        if (previous.getPlayerId() != null) {
            players.revokeCredit(previous.getPlayerId(), saved.getId());
        }
        ledger.clearEffect(EffectKeys.sideEffect(ref, EffectKeys.ITEM_CREATED));
        ledger.clearEffect(EffectKeys.sideEffect(ref, EffectKeys.FINANCIAL_CREATED));
        ledger.clearEffect(EffectKeys.sideEffect(ref, EffectKeys.POINTS_AWARDED));
        Log.infof("Task %s left %s: completion effects undone", saved.getId(), RecordStatus.DONE);
    }
}
