package com.e2eq.links.records.actions;

import com.e2eq.links.core.ActionHandler;
import com.e2eq.links.core.ActionRequest;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkableEntity;
import com.e2eq.links.orchestration.EntityOrchestrator;
import com.e2eq.links.records.model.FinancialRecord;
import com.e2eq.links.records.model.RecordStatus;
import com.e2eq.links.records.model.Sale;
import com.e2eq.links.records.model.Task;
import com.e2eq.links.records.repo.FinancialRecordRepo;
import io.quarkus.logging.Log;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

/**
 * Books the financial record of a completed task or sale.
 */
@Singleton
public class FinancialRecordActionHandler implements ActionHandler {

    private final FinancialRecordRepo financials;
    private final EntityOrchestrator orchestrator;

    @Inject
    public FinancialRecordActionHandler(FinancialRecordRepo financials, EntityOrchestrator orchestrator) {
        this.financials = financials;
        this.orchestrator = orchestrator;
    }

    @Override
    public EntityType entityType() {
        return EntityType.FINANCIAL;
    }

    @Override
    public void handle(ActionRequest request) {
        LinkableEntity subject = request.subject();
        switch (request.action()) {
            case CREATE_TARGET -> {
                if (subject instanceof Task task) {
                    create(fromTask(task));
                } else if (subject instanceof Sale sale) {
                    create(fromSale(sale));
                } else {
                    Log.warnf("No financial record is booked for %s", subject.ref());
                }
            }
            case UPDATE_TARGET -> {
                if (subject instanceof Task task) updateFromTask(task);
            }
            default -> Log.warnf("Financial action %s is not supported", request.action());
        }
    }

    private void create(FinancialRecord record) {
        if (financials.exists(record.getId())) {
            Log.debugf("Financial record %s already exists", record.getId());
            return;
        }
        orchestrator.upsert(record);
        Log.infof("Financial record %s booked", record.getId());
    }

    static FinancialRecord fromTask(Task task) {
        return FinancialRecord.builder()
                .id(FinancialRecord.forTask(task.getId()))
                .name(task.getName())
                .status(RecordStatus.DONE)
                .cost(task.getCost())
                .revenue(task.getRevenue())
                .sourceTaskId(task.getId())
                .siteId(task.getSiteId())
                .customerCharacterId(task.getCustomerCharacterId())
                .build();
    }

    static FinancialRecord fromSale(Sale sale) {
        return FinancialRecord.builder()
                .id(FinancialRecord.forSale(sale.getId()))
                .name(sale.getName())
                .status(RecordStatus.DONE)
                .cost(BigDecimal.ZERO)
                .revenue(sale.totalRevenue())
                .sourceSaleId(sale.getId())
                .siteId(sale.getSiteId())
                .customerCharacterId(sale.getCustomerCharacterId())
                .build();
    }

    private void updateFromTask(Task task) {
        Optional<FinancialRecord> found = financials.get(FinancialRecord.forTask(task.getId()));
        if (found.isEmpty()) return;
        FinancialRecord record = found.get();
        if (sameAmount(record.getCost(), task.getCost()) && sameAmount(record.getRevenue(), task.getRevenue())) return;
        record.setCost(task.getCost());
        record.setRevenue(task.getRevenue());
        orchestrator.upsert(record);
        Log.debugf("Financial record %s updated from task %s", record.getId(), task.getId());
    }

    private static boolean sameAmount(BigDecimal a, BigDecimal b) {
        if (a == null || b == null) return Objects.equals(a, b);
        return a.compareTo(b) == 0;
    }
}
