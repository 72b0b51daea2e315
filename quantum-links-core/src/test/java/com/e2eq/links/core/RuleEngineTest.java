package com.e2eq.links.core;

import com.e2eq.links.exceptions.BlockedDeletionException;
import com.e2eq.links.exceptions.DepthExceededException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

public class RuleEngineTest {

    private static final EntityRef TASK = EntityRef.of(EntityType.TASK, "t1");
    private static final EntityRef ITEM = EntityRef.of(EntityType.ITEM, "i1");
    private static final EntityRef FIN = EntityRef.of(EntityType.FINANCIAL, "f1");
    private static final EntityRef SALE = EntityRef.of(EntityType.SALE, "s1");
    private static final EntityRef SITE = EntityRef.of(EntityType.SITE, "hq");

    private LinkRegistry registry;
    private ActionHandlerRegistry handlers;
    private final Map<EntityRef, LinkableEntity> entities = new HashMap<>();

    @BeforeEach
    public void setUp() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        MutableClock clock = new MutableClock();
        JsonCodec codec = new JsonCodec();
        registry = new LinkRegistry(store, codec, new LinkValidator(), new LinkLog(new EventLog(store, codec, clock), clock), clock);
        handlers = new ActionHandlerRegistry();
    }

    @Test
    public void testCascadeClosureIsBreadthFirst() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.ITEM_FINREC, ITEM, FIN));
        registry.createLink(Link.of(LinkType.TASK_SALE, TASK, SALE));

        DeletePlan plan = engine(table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.ITEM_FINREC, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.TASK_SALE, DeletePolicy.CASCADE, DeletePolicy.IGNORE)), 5).planDelete(TASK);

        assertEquals(List.of(ITEM, SALE, FIN), plan.cascadeTargets());
        assertEquals(List.of(1, 1, 2), plan.cascades().stream().map(DeletePlan.CascadeStep::depth).toList());
        assertTrue(plan.decisions().isEmpty());
    }

    @Test
    public void testCyclesVisitEachEntityOnce() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.ITEM_TASK, ITEM, TASK));

        DeletePlan plan = engine(table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.CASCADE),
                rule(LinkType.ITEM_TASK, DeletePolicy.CASCADE, DeletePolicy.CASCADE)), 5).planDelete(TASK);

        assertEquals(List.of(ITEM), plan.cascadeTargets());
    }

    @Test
    public void testPromptsAreCollectedForCounterpartsLeftInPlace() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        Link itemSale = Link.of(LinkType.SALE_ITEM, SALE, ITEM);
        registry.createLink(itemSale);

        DeletePlan plan = engine(table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.SALE_ITEM, DeletePolicy.IGNORE, DeletePolicy.PROMPT)), 5).planDelete(TASK);

        assertEquals(1, plan.decisions().size());
        DecisionNeeded d = plan.decisions().get(0);
        assertEquals(DecisionNeeded.Kind.DELETE, d.kind());
        assertEquals(ITEM, d.entity());
        assertEquals(SALE, d.counterpart());
        assertEquals(itemSale.getId(), d.link().getId());
        assertTrue(d.message().contains("sale:s1"));
    }

    @Test
    public void testBlockAbortsBeforeAnythingChanges() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.SALE_ITEM, SALE, ITEM));

        RuleEngine engine = engine(table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.SALE_ITEM, DeletePolicy.IGNORE, DeletePolicy.BLOCK)), 5);

        BlockedDeletionException ex = assertThrows(BlockedDeletionException.class, () -> engine.planDelete(TASK));
        assertEquals(1, ex.getBlockingLinks().size());
        assertEquals(2, registry.getAllLinks().size());
    }

    @Test
    public void testBlockTowardTheClosureItselfIsIgnored() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.ITEM_TASK, ITEM, TASK));

        DeletePlan plan = engine(table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.ITEM_TASK, DeletePolicy.BLOCK, DeletePolicy.IGNORE)), 5).planDelete(TASK);

        assertEquals(List.of(ITEM), plan.cascadeTargets());
    }

    @Test
    public void testCascadeDeeperThanTheLimitFails() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.ITEM_FINREC, ITEM, FIN));
        registry.createLink(Link.of(LinkType.FINREC_SITE, FIN, SITE));
        LinkRuleTable table = table(
                rule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.ITEM_FINREC, DeletePolicy.CASCADE, DeletePolicy.IGNORE),
                rule(LinkType.FINREC_SITE, DeletePolicy.CASCADE, DeletePolicy.IGNORE));

        DepthExceededException ex = assertThrows(DepthExceededException.class, () -> engine(table, 2).planDelete(TASK));
        assertEquals(2, ex.getMaxDepth());
        assertEquals(3, engine(table, 3).planDelete(TASK).cascades().size());
    }

    @Test
    public void testPropagateRunsUpdateRulesTowardTheCounterpart() {
        RecordingActionHandler itemHandler = new RecordingActionHandler(EntityType.ITEM);
        handlers.register(itemHandler);
        SimpleEntity item = SimpleEntity.of(EntityType.ITEM, "i1", "Stocked", Map.of());
        entities.put(ITEM, item);
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));
        registry.createLink(Link.of(LinkType.TASK_SALE, TASK, SALE));

        LinkRuleTable table = new LinkRuleTable(List.of(
                new LinkRule(LinkType.TASK_ITEM, null, null, UpdatePolicy.PROPAGATE, null),
                new LinkRule(LinkType.TASK_SALE, null, null, UpdatePolicy.PROMPT, null)),
                List.of(new DirectionalRule(LinkType.TASK_ITEM, RuleDirection.FORWARD, LifecycleEvent.UPDATE,
                        RuleAction.UPDATE_TARGET, List.of(new RuleCondition.StatusEquals(LinkSide.SOURCE, "Done")))));

        SimpleEntity task = SimpleEntity.of(EntityType.TASK, "t1", "Done", Map.of());
        UpdateOutcome outcome = engine(table, 5).propagateUpdate(task, null);

        assertEquals(1, outcome.propagated().size());
        assertSame(item, itemHandler.requests.get(0).context().counterpart());
        assertEquals(1, outcome.decisions().size());
        assertEquals(SALE, outcome.decisions().get(0).counterpart());
        assertEquals(DecisionNeeded.Kind.UPDATE, outcome.decisions().get(0).kind());
    }

    @Test
    public void testLinksAreGroupedByTypeInFirstSeenOrder() {
        Link a = Link.of(LinkType.TASK_ITEM, TASK, ITEM);
        Link b = Link.of(LinkType.TASK_SALE, TASK, SALE);
        Link c = Link.of(LinkType.TASK_ITEM, TASK, EntityRef.of(EntityType.ITEM, "i2"));

        assertEquals(List.of(a, c, b), RuleEngine.groupByType(List.of(a, b, c)));
    }

    private RuleEngine engine(LinkRuleTable table, int maxDepth) {
        EntityResolver resolver = ref -> Optional.ofNullable(entities.get(ref));
        return new RuleEngine(table, registry, new TriggerEvaluator(table, handlers), resolver, maxDepth);
    }

    private static LinkRuleTable table(LinkRule... rules) {
        return new LinkRuleTable(List.of(rules), List.of());
    }

    private static LinkRule rule(LinkType type, DeletePolicy onSourceDelete, DeletePolicy onTargetDelete) {
        return new LinkRule(type, onSourceDelete, onTargetDelete, null, null);
    }
}
