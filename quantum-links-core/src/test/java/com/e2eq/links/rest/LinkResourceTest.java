package com.e2eq.links.rest;

import com.e2eq.links.core.*;
import com.e2eq.links.exceptions.NotFoundException;
import com.e2eq.links.exceptions.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LinkResourceTest {

    private static final EntityRef TASK = EntityRef.of(EntityType.TASK, "t1");
    private static final EntityRef ITEM = EntityRef.of(EntityType.ITEM, "i1");

    private LinkRegistry registry;
    private ProcessingGuard guard;
    private LinkResource resource;

    @BeforeEach
    public void setUp() {
        InMemoryKeyValueStore store = new InMemoryKeyValueStore();
        JsonCodec codec = new JsonCodec();
        MutableClock clock = new MutableClock();
        registry = new LinkRegistry(store, codec, new LinkValidator(), new LinkLog(new EventLog(store, codec, clock), clock), clock);
        guard = new ProcessingGuard(store, codec, clock);
        LinkRuleTable rules = new LinkRuleTable(
                List.of(new LinkRule(LinkType.TASK_ITEM, DeletePolicy.CASCADE, null, null, null)), List.of());
        resource = new LinkResource(registry, guard, rules);
    }

    @Test
    public void testLinksAreListedByEntityTypeAndId() {
        Link link = Link.of(LinkType.TASK_ITEM, TASK, ITEM);
        registry.createLink(link);

        assertEquals(1, resource.linksFor("task", "t1").size());
        assertEquals(1, resource.linksFor("ITEM", "i1").size());
        assertEquals(1, resource.linksByType("task_item").size());
        assertEquals(link.getId(), resource.link(link.getId()).getId());
    }

    @Test
    public void testGraphAcceptsAnyType() {
        registry.createLink(Link.of(LinkType.TASK_ITEM, TASK, ITEM));

        assertEquals(1, resource.graph("any", "t1").linkCount());
        assertEquals(1, resource.graph("task", "t1").linkCount());
    }

    @Test
    public void testUnknownValuesAreReported() {
        assertThrows(NotFoundException.class, () -> resource.link("nope"));
        assertThrows(ValidationException.class, () -> resource.linksFor("planet", "p1"));
        assertThrows(ValidationException.class, () -> resource.linksByType("TASK_PLANET"));
    }

    @Test
    public void testProcessingStatusAndRulesAreExposed() {
        guard.startProcessing(EntityType.TASK, "t1");

        assertEquals(1, resource.processing().depth());
        assertEquals(DeletePolicy.CASCADE, resource.rules().rules().get(0).onSourceDelete());
        assertTrue(resource.rules().directional().isEmpty());
    }
}
