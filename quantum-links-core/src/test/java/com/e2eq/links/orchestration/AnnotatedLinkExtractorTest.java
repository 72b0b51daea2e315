package com.e2eq.links.orchestration;

import com.e2eq.links.annotations.LinkedBy;
import com.e2eq.links.core.EntityRef;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.exceptions.LinkEngineException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class AnnotatedLinkExtractorTest {

    private final AnnotatedLinkExtractor extractor = new AnnotatedLinkExtractor();

    @Test
    public void testFieldsAndCollectionsBecomeDesiredLinks() {
        TestTask task = new TestTask("t1", "Created").siteId("s1").items("i1", " ", "i2");

        List<DesiredLink> links = extractor.extract(task);

        assertEquals(List.of(
                DesiredLink.to(LinkType.TASK_SITE, "s1"),
                DesiredLink.to(LinkType.TASK_ITEM, "i1"),
                DesiredLink.to(LinkType.TASK_ITEM, "i2")), links);
        assertEquals(EntityRef.of(EntityType.SITE, "s1"), links.get(0).target());
        assertEquals(Set.of(LinkType.TASK_SITE, LinkType.TASK_ITEM), extractor.linkTypesOf(TestTask.class));
    }

    @Test
    public void testNullValuesProduceNothing() {
        assertTrue(extractor.extract(new TestTask("t1", "Created")).isEmpty());
    }

    @Test
    public void testBindingsAreCachedPerClass() {
        assertSame(extractor.bindingsOf(TestTask.class), extractor.bindingsOf(TestTask.class));
        assertTrue(extractor.bindingsOf(TestItem.class).isEmpty());
    }

    @Test
    public void testAnnotatedMethodsAreRead() {
        DesiredLink link = extractor.extract(new WithMethod()).get(0);
        assertEquals(DesiredLink.to(LinkType.SALE_SITE, "hq"), link);
    }

    @Test
    public void testAnnotatedMethodWithParametersIsRejected() {
        assertThrows(LinkEngineException.class, () -> extractor.bindingsOf(BadMethod.class));
    }

    static class WithMethod extends TestEntityBase {
        @LinkedBy(LinkType.SALE_SITE)
        String site() {
            return "hq";
        }
    }

    static class BadMethod extends TestEntityBase {
        @LinkedBy(LinkType.SALE_SITE)
        String site(String prefix) {
            return prefix;
        }
    }

    abstract static class TestEntityBase implements com.e2eq.links.core.LinkableEntity {
        @Override public String getId() { return "s1"; }
        @Override public EntityType entityType() { return EntityType.SALE; }
        @Override public String lifecycleStatus() { return null; }
        @Override public Map<String, Object> triggerMetadata() { return Map.of(); }
    }
}
