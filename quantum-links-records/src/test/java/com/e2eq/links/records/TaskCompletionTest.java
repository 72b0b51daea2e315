package com.e2eq.links.records;

import com.e2eq.links.core.EffectKeys;
import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.exceptions.SideEffectsIncompleteException;
import com.e2eq.links.records.model.*;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

public class TaskCompletionTest {

    private static final EntityRef TASK = EntityRef.of(EntityType.TASK, "t1");
    private static final EntityRef ITEM = EntityRef.of(EntityType.ITEM, Item.completionId("t1"));

    private RecordsHarness h;

    @BeforeEach
    public void setUp() {
        h = new RecordsHarness();
    }

    private static Task stickerTask(String status) {
        return Task.builder()
                .id("t1")
                .name("Print stickers")
                .status(status)
                .outputItemType("Sticker")
                .outputQuantity(5)
                .outputUnitCost(new BigDecimal("0.50"))
                .outputItemPrice(new BigDecimal("2.00"))
                .build();
    }

    @Test
    public void testCompletingTaskCreatesItemOnce() {
        h.orchestrator.upsert(stickerTask(RecordStatus.CREATED));
        assertTrue(h.items.list().isEmpty());

        h.orchestrator.upsert(stickerTask(RecordStatus.DONE));

        Item item = h.items.get(ITEM.id()).orElseThrow();
        assertEquals(5, item.totalQuantity());
        assertEquals("Sticker", item.getType());
        assertEquals("t1", item.getSourceTaskId());
        assertTrue(h.links.findExisting(LinkType.TASK_ITEM, TASK, ITEM).isPresent());
        assertTrue(h.links.findExisting(LinkType.ITEM_TASK, ITEM, TASK).isPresent());
        assertTrue(h.ledger.hasEffect("task:t1:itemCreated"));
        int linkCount = h.links.getAllLinks().size();

        h.orchestrator.upsert(stickerTask(RecordStatus.DONE));

        assertEquals(1, h.items.list().size());
        assertEquals(linkCount, h.links.getAllLinks().size());
        assertFalse(h.guard.getProcessingStatus().processing());
    }

    @Test
    public void testTaskWithoutOutputCreatesNoItem() {
        h.orchestrator.upsert(Task.builder().id("t1").status(RecordStatus.DONE).build());

        assertTrue(h.items.list().isEmpty());
        assertFalse(h.ledger.hasEffect(EffectKeys.sideEffect(TASK, EffectKeys.ITEM_CREATED)));
    }

    @Test
    public void testFinancialsAndPointsAreAppliedOnce() {
        h.orchestrator.upsert(Player.builder().id("p1").name("Pat").points(3).build());
        Task task = stickerTask(RecordStatus.DONE).toBuilder()
                .cost(new BigDecimal("10"))
                .revenue(new BigDecimal("25"))
                .playerId("p1")
                .rewardPoints(7)
                .build();

        h.orchestrator.upsert(task);
        h.orchestrator.upsert(task.toBuilder().build());

        FinancialRecord record = h.financials.get(FinancialRecord.forTask("t1")).orElseThrow();
        assertEquals(0, new BigDecimal("25").compareTo(record.getRevenue()));
        assertEquals(RecordStatus.DONE, record.getStatus());
        assertEquals(1, h.financials.list().size());
        assertEquals(10, h.players.get("p1").orElseThrow().getPoints());
        assertTrue(h.links.findExisting(LinkType.TASK_FINREC, TASK,
                EntityRef.of(EntityType.FINANCIAL, record.getId())).isPresent());
    }

    @Test
    public void testLeavingDoneUndoesCompletion() {
        h.orchestrator.upsert(Player.builder().id("p1").points(0).build());
        Task done = stickerTask(RecordStatus.DONE).toBuilder()
                .revenue(new BigDecimal("25"))
                .playerId("p1")
                .rewardPoints(7)
                .build();
        h.orchestrator.upsert(done);
        assertEquals(7, h.players.get("p1").orElseThrow().getPoints());

        h.orchestrator.upsert(done.toBuilder().status(RecordStatus.IN_PROGRESS).build());

        assertTrue(h.items.list().isEmpty());
        assertTrue(h.financials.list().isEmpty());
        assertEquals(0, h.players.get("p1").orElseThrow().getPoints());
        assertFalse(h.ledger.hasEffect("task:t1:itemCreated"));
        assertFalse(h.ledger.hasEffect("task:t1:financialCreated"));
        assertFalse(h.ledger.hasEffect("task:t1:pointsAwarded"));
        assertTrue(h.links.getLinksByType(LinkType.TASK_ITEM).isEmpty());

        h.orchestrator.upsert(done.toBuilder().build());

        assertEquals(1, h.items.list().size());
        assertEquals(7, h.players.get("p1").orElseThrow().getPoints());
    }

    private int pointsOf(String playerId) {
        return h.players.get(playerId).orElseThrow().getPoints();
    }

    @Test
    public void testMissingPlayerLeavesPointsEffectUnmarked() {
        Task done = stickerTask(RecordStatus.DONE).toBuilder().playerId("p1").rewardPoints(7).build();

        assertThrows(SideEffectsIncompleteException.class, () -> h.orchestrator.upsert(done));
        assertTrue(h.tasks.get("t1").isPresent());
        assertFalse(h.ledger.hasEffect("task:t1:pointsAwarded"));
        assertFalse(h.guard.getProcessingStatus().processing());

        h.orchestrator.upsert(Player.builder().id("p1").points(3).build());
        h.orchestrator.upsert(done.toBuilder().build());
        assertEquals(10, pointsOf("p1"));
        assertTrue(h.ledger.hasEffect("task:t1:pointsAwarded"));

        h.orchestrator.upsert(done.toBuilder().status(RecordStatus.CREATED).build());
        assertEquals(3, pointsOf("p1"));
    }

    @Test
    public void testUncompletionRevokesCreditedPointsNotCurrentReward() {
        h.orchestrator.upsert(Player.builder().id("p1").points(3).build());
        Task done = stickerTask(RecordStatus.DONE).toBuilder().playerId("p1").rewardPoints(7).build();
        h.orchestrator.upsert(done);
        assertEquals(10, pointsOf("p1"));
        assertEquals(7, h.players.get("p1").orElseThrow().getCredits().get("t1").intValue());

        h.orchestrator.upsert(done.toBuilder().rewardPoints(10).build());
        assertEquals(10, pointsOf("p1"));

        h.orchestrator.upsert(done.toBuilder().rewardPoints(10).status(RecordStatus.CREATED).build());
        assertEquals(3, pointsOf("p1"));
        assertTrue(h.players.get("p1").orElseThrow().getCredits().isEmpty());
    }

    @Test
    public void testReassigningPlayerMovesCredit() {
        h.orchestrator.upsert(Player.builder().id("p1").build());
        h.orchestrator.upsert(Player.builder().id("p2").build());
        Task done = stickerTask(RecordStatus.DONE).toBuilder().playerId("p1").rewardPoints(7).build();
        h.orchestrator.upsert(done);

        h.orchestrator.upsert(done.toBuilder().playerId("p2").build());
        assertEquals(0, pointsOf("p1"));
        assertEquals(7, pointsOf("p2"));

        h.orchestrator.upsert(done.toBuilder().playerId("p2").status(RecordStatus.IN_PROGRESS).build());
        assertEquals(0, pointsOf("p2"));
    }

    @Test
    public void testCollectedKeepsCompletionEffects() {
        h.orchestrator.upsert(stickerTask(RecordStatus.DONE));

        h.orchestrator.upsert(stickerTask(RecordStatus.COLLECTED));

        assertTrue(h.items.get(ITEM.id()).isPresent());
        assertTrue(h.ledger.hasEffect("task:t1:itemCreated"));
    }

    @Test
    public void testOutputChangesPropagateToDerivedRecords() {
        Task done = stickerTask(RecordStatus.DONE).toBuilder().cost(new BigDecimal("4")).build();
        h.orchestrator.upsert(done);

        h.orchestrator.upsert(done.toBuilder()
                .outputQuantity(8)
                .outputItemPrice(new BigDecimal("2.50"))
                .cost(new BigDecimal("6"))
                .build());

        Item item = h.items.get(ITEM.id()).orElseThrow();
        assertEquals(8, item.totalQuantity());
        assertEquals(0, new BigDecimal("2.50").compareTo(item.getPrice()));
        assertEquals(0, new BigDecimal("6").compareTo(h.financials.get(FinancialRecord.forTask("t1")).orElseThrow().getCost()));
        assertEquals(8, ((Number) h.links.findExisting(LinkType.TASK_ITEM, TASK, ITEM).orElseThrow()
                .getMetadata().get("quantity")).intValue());
    }

    @Test
    public void testNewCustomerNameCreatesCharacterOnce() {
        Task task = stickerTask(RecordStatus.CREATED).toBuilder().newCustomerName("Ada").build();

        h.orchestrator.upsert(task);

        String characterId = CharacterRecord.customerOf("t1");
        CharacterRecord customer = h.characters.get(characterId).orElseThrow();
        assertEquals("Ada", customer.getName());
        assertTrue(customer.getRoles().contains(CharacterRecord.ROLE_CUSTOMER));
        assertEquals(characterId, h.tasks.get("t1").orElseThrow().getCustomerCharacterId());
        assertTrue(h.links.findExisting(LinkType.TASK_CHARACTER, TASK,
                EntityRef.of(EntityType.CHARACTER, characterId)).isPresent());

        // saving again without the id does not create a second character
        h.orchestrator.upsert(task.toBuilder().build());
        assertEquals(1, h.characters.list().size());
    }

    @Test
    public void testCompletionMarksCustomerActive() {
        h.orchestrator.upsert(CharacterRecord.builder().id("c1").name("Bo").build());

        h.orchestrator.upsert(stickerTask(RecordStatus.DONE).toBuilder().customerCharacterId("c1").build());

        assertEquals(RecordsHarness.NOW, h.characters.get("c1").orElseThrow().getLastActiveAt());
    }
}
