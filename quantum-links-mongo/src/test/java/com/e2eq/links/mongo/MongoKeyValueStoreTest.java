package com.e2eq.links.mongo;

import org.bson.Document;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

public class MongoKeyValueStoreTest {

    @Test
    public void testValueDocumentShape() {
        Document d = MongoKeyValueStore.valueDocument("links:link:l1", "{\"id\":\"l1\"}");
        assertEquals("links:link:l1", d.getString("_id"));
        assertEquals("{\"id\":\"l1\"}", d.getString("value"));
        assertEquals(2, d.size());
    }

    @Test
    public void testMembersKeepStoredOrder() {
        Document d = new Document("_id", "index:links:by-entity:task:t1").append("members", List.of("b", "a", "c"));
        assertEquals(List.of("b", "a", "c"), MongoKeyValueStore.membersOf(d));
        assertEquals(List.of(), MongoKeyValueStore.membersOf(null));
        assertEquals(List.of(), MongoKeyValueStore.membersOf(new Document("_id", "x").append("value", "v")));
    }

    @Test
    public void testPrefixRegexIsLiteral() {
        Pattern p = Pattern.compile(MongoKeyValueStore.prefixRegex("effects:task:t1:"));
        assertTrue(p.matcher("effects:task:t1:itemCreated").find());
        assertFalse(p.matcher("effects:task:t10:itemCreated").find());
        assertFalse(p.matcher("xeffects:task:t1:itemCreated").find());

        Pattern dotted = Pattern.compile(MongoKeyValueStore.prefixRegex("data:item:a.b"));
        assertFalse(dotted.matcher("data:item:aXb").find());
    }

    @Test
    public void testMGetKeepsRequestOrderAndDropsMissing() {
        Map<String, String> ordered = MongoKeyValueStore.inRequestOrder(List.of("k3", "k1", "k2"),
                Map.of("k1", "v1", "k3", "v3"));
        assertEquals(List.of("k3", "k1"), List.copyOf(ordered.keySet()));
    }
}
