package com.e2eq.links.core;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Records link creation, metadata updates and removal under {@code logs:links}.
 */
public class LinkLog {

    public static final String NAME = "links";

    public record Entry(String entryId, String event, String linkId, LinkType linkType,
                        EntityRef source, EntityRef target, Instant at) { }

    private final EventLog log;
    private final Clock clock;

    public LinkLog(EventLog log, Clock clock) {
        this.log = log;
        this.clock = clock;
    }

    public void created(Link link) {
        append("created", link);
    }

    public void updated(Link link) {
        append("updated", link);
    }

    public void removed(Link link) {
        append("removed", link);
    }

    public List<Entry> entries() {
        return log.read(NAME, Entry.class);
    }

    private void append(String event, Link link) {
        log.append(NAME, new Entry(UUID.randomUUID().toString(), event, link.getId(), link.getLinkType(),
                link.getSource(), link.getTarget(), clock.instant()));
    }
}
