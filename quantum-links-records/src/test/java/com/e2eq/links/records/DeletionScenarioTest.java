package com.e2eq.links.records;

import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.orchestration.DeleteResult;
import com.e2eq.links.records.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeletionScenarioTest {

    private static final EntityRef SALE = EntityRef.of(EntityType.SALE, "s1");
    private static final EntityRef ITEM = EntityRef.of(EntityType.ITEM, "i1");

    private RecordsHarness h;

    @BeforeEach
    public void setUp() {
        h = new RecordsHarness();
    }

    private Sale saleOfItem(String status) {
        return Sale.builder()
                .id("s1")
                .name("Market day")
                .status(status)
                .lines(new java.util.ArrayList<>(List.of(new SaleLine("i1", 2, new BigDecimal("3.50")))))
                .build();
    }

    @Test
    public void testSaleDeletePromptsAndKeepsItem() {
        h.orchestrator.upsert(Item.builder().id("i1").name("Mug").status(RecordStatus.IN_STOCK).build());
        h.orchestrator.upsert(saleOfItem(RecordStatus.PENDING));
        assertEquals(2, ((Number) h.links.findExisting(LinkType.SALE_ITEM, SALE, ITEM).orElseThrow()
                .getMetadata().get("quantity")).intValue());

        DeleteResult result = h.orchestrator.remove(EntityType.SALE, "s1");

        assertTrue(result.decisionNeeded());
        assertEquals(ITEM, result.decisions().get(0).counterpart());
        assertTrue(h.sales.get("s1").isEmpty());
        assertTrue(h.items.get("i1").isPresent());
        assertTrue(h.links.getLinksFor(SALE).isEmpty());
    }

    @Test
    public void testTaskDeleteCascadesToItsItem() {
        h.orchestrator.upsert(Task.builder().id("t1").status(RecordStatus.DONE)
                .outputItemType("Sticker").outputQuantity(5).build());
        String itemId = Item.completionId("t1");
        assertTrue(h.items.get(itemId).isPresent());

        DeleteResult result = h.orchestrator.remove(EntityType.TASK, "t1");

        assertEquals(List.of(EntityRef.of(EntityType.TASK, "t1"), EntityRef.of(EntityType.ITEM, itemId)), result.deleted());
        assertTrue(h.tasks.get("t1").isEmpty());
        assertTrue(h.items.get(itemId).isEmpty());
        assertTrue(h.links.getLinksByType(LinkType.TASK_ITEM).isEmpty());
        assertTrue(h.links.getLinksByType(LinkType.ITEM_TASK).isEmpty());
        assertTrue(h.ledger.effectsOf("task", "t1").isEmpty());
    }

    @Test
    public void testTaskDeleteLeavesFinancialRecordForDecision() {
        h.orchestrator.upsert(Task.builder().id("t1").status(RecordStatus.DONE).revenue(new BigDecimal("12")).build());
        String finId = FinancialRecord.forTask("t1");

        DeleteResult result = h.orchestrator.remove(EntityType.TASK, "t1");

        assertTrue(result.decisionNeeded());
        assertTrue(h.financials.get(finId).isPresent());
        assertTrue(h.links.getLinksFor(EntityRef.of(EntityType.FINANCIAL, finId)).isEmpty());
    }

    @Test
    public void testCompletedSaleBooksOneFinancialRecord() {
        h.orchestrator.upsert(Item.builder().id("i1").name("Mug").build());
        h.orchestrator.upsert(saleOfItem(RecordStatus.DONE));
        h.orchestrator.upsert(saleOfItem(RecordStatus.DONE));

        FinancialRecord record = h.financials.get(FinancialRecord.forSale("s1")).orElseThrow();
        assertEquals(0, new BigDecimal("7.00").compareTo(record.getRevenue()));
        assertEquals(1, h.financials.list().size());
        EntityRef fin = EntityRef.of(EntityType.FINANCIAL, record.getId());
        assertTrue(h.links.findExisting(LinkType.SALE_FINREC, SALE, fin).isPresent());
        assertTrue(h.links.findExisting(LinkType.FINREC_SALE, fin, SALE).isPresent());
        assertTrue(h.ledger.hasEffect("sale:s1:financialCreated"));
    }

    @Test
    public void testDeletingUnknownRecordFails() {
        assertThrows(com.e2eq.links.exceptions.NotFoundException.class,
                () -> h.orchestrator.remove(EntityType.ITEM, "missing"));
    }
}
