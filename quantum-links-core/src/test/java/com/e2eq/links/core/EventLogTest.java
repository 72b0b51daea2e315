package com.e2eq.links.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class EventLogTest {

    public record Note(String text) { }

    private InMemoryKeyValueStore store;
    private MutableClock clock;
    private EventLog log;

    @BeforeEach
    public void setUp() {
        store = new InMemoryKeyValueStore();
        clock = new MutableClock();
        log = new EventLog(store, new JsonCodec(), clock);
    }

    @Test
    public void testEachEntryIsItsOwnKey() {
        log.append("links", new Note("a"));
        log.append("links", new Note("b"));
        log.append("links", new Note("c"));

        assertEquals(3, store.keys(KvKeys.logPrefix("links")).size());
        assertTrue(store.sMembers("logs:links").isEmpty());
    }

    @Test
    public void testEntriesReadBackInAppendOrder() {
        for (int i = 0; i < 12; i++) {
            log.append("task", new Note("n" + i));
        }
        clock.advance(Duration.ofMillis(1));
        log.append("task", new Note("later"));

        List<String> texts = log.read("task", Note.class).stream().map(Note::text).toList();

        assertEquals(13, texts.size());
        assertEquals("n0", texts.get(0));
        assertEquals("n10", texts.get(10));
        assertEquals("later", texts.get(12));
    }

    @Test
    public void testLogsWithSharedNamePrefixStaySeparate() {
        log.append("task", new Note("task"));
        log.append("task-archive", new Note("archive"));

        assertEquals(List.of(new Note("task")), log.read("task", Note.class));
        assertEquals(List.of(new Note("archive")), log.read("task-archive", Note.class));
        assertTrue(log.read("sale", Note.class).isEmpty());
    }

    @Test
    public void testAppendFailureDoesNotReachCaller() {
        EventLog failing = new EventLog(new InMemoryKeyValueStore() {
            @Override
            public void set(String key, String value) {
                throw new IllegalStateException("store down");
            }
        }, new JsonCodec(), clock);

        assertDoesNotThrow(() -> failing.append("links", new Note("lost")));
    }
}
