package com.e2eq.links.core;

import com.e2eq.links.exceptions.NotFoundException;
import com.e2eq.links.exceptions.ValidationException;
import io.quarkus.logging.Log;

import java.time.Clock;
import java.time.Instant;
import java.util.*;
import java.util.function.Predicate;

/**
 * Stores typed directed links and keeps two reverse indexes per link, one for each end, so
 * {@link #getLinksFor} finds a link from either side. Index members keep insertion order,
 * which is the order links are returned in. The per-type index is one key per link.
 *
 * <p>Record writes and index updates are separate store calls without a transaction.</p>
 */
public class LinkRegistry {

    private final KeyValueStore store;
    private final JsonCodec codec;
    private final LinkValidator validator;
    private final LinkLog linkLog;
    private final Clock clock;

    public LinkRegistry(KeyValueStore store, JsonCodec codec, LinkValidator validator, LinkLog linkLog, Clock clock) {
        this.store = store;
        this.codec = codec;
        this.validator = validator;
        this.linkLog = linkLog;
        this.clock = clock;
    }

    /**
     * Validates and stores a link.
     *
     * @return false when nothing was written: a link with the same id, or with the same type and
     *         ends, already exists
     */
    public boolean createLink(Link link) {
        validator.validate(link);
        if (store.get(KvKeys.link(link.getId())).isPresent()) {
            Log.debugf("Link %s already stored", link.getId());
            return false;
        }
        Optional<Link> duplicate = findExisting(link.getLinkType(), link.getSource(), link.getTarget());
        if (duplicate.isPresent()) {
            Log.debugf("Link %s %s -> %s already exists as %s", link.getLinkType(), link.getSource(),
                    link.getTarget(), duplicate.get().getId());
            return false;
        }
        if (link.getCreatedAt() == null) {
            link.setCreatedAt(clock.instant());
        }
        store.set(KvKeys.link(link.getId()), codec.write(link));
        store.sAdd(KvKeys.byEntity(link.getSource()), link.getId());
        store.sAdd(KvKeys.byEntity(link.getTarget()), link.getId());
        store.set(KvKeys.byType(link.getLinkType(), link.getId()), link.getId());
        Log.debugf("Link created: %s", link);
        linkLog.created(link);
        return true;
    }

    public Optional<Link> getLink(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return store.get(KvKeys.link(id)).map(json -> codec.read(json, Link.class));
    }

    /** Every link where {@code ref} is the source or the target, in index order. */
    public List<Link> getLinksFor(EntityRef ref) {
        if (ref == null) throw new ValidationException("Entity reference must not be null");
        return fetch(store.sMembers(KvKeys.byEntity(ref)));
    }

    public Optional<Link> findExisting(LinkType linkType, EntityRef source, EntityRef target) {
        for (Link l : getLinksFor(source)) {
            if (l.getLinkType() == linkType && source.equals(l.getSource()) && target.equals(l.getTarget())) {
                return Optional.of(l);
            }
        }
        return Optional.empty();
    }

    /** Links of one type, oldest first. */
    public List<Link> getLinksByType(LinkType linkType) {
        if (linkType == null) throw new ValidationException("Link type must not be null");
        String prefix = KvKeys.byTypePrefix(linkType);
        List<String> ids = store.keys(prefix).stream()
                .map(k -> k.substring(prefix.length()))
                .toList();
        List<Link> links = new ArrayList<>(fetch(ids));
        links.sort(Comparator.<Link, Instant>comparing(Link::getCreatedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
                .thenComparing(Link::getId));
        return links;
    }

    public List<Link> getAllLinks() {
        List<String> ids = store.keys(KvKeys.LINK_PREFIX).stream()
                .map(k -> k.substring(KvKeys.LINK_PREFIX.length()))
                .toList();
        return fetch(ids);
    }

    public Link updateLinkMetadata(String id, Map<String, Object> metadata) {
        Link link = getLink(id).orElseThrow(() -> new NotFoundException("link", id));
        validator.validateMetadata(metadata);
        link.setMetadata(metadata == null || metadata.isEmpty() ? null : new LinkedHashMap<>(metadata));
        link.setUpdatedAt(clock.instant());
        store.set(KvKeys.link(id), codec.write(link));
        linkLog.updated(link);
        return link;
    }

    /** @return true if the link existed */
    public boolean removeLink(String id) {
        Optional<Link> found = getLink(id);
        if (found.isEmpty()) {
            return false;
        }
        Link link = found.get();
        store.delete(KvKeys.link(id));
        store.sRem(KvKeys.byEntity(link.getSource()), id);
        store.sRem(KvKeys.byEntity(link.getTarget()), id);
        store.delete(KvKeys.byType(link.getLinkType(), id));
        Log.debugf("Link removed: %s", link);
        linkLog.removed(link);
        return true;
    }

    /** Removes every link touching {@code ref}. @return the number removed */
    public int removeLinksFor(EntityRef ref) {
        int removed = 0;
        for (Link l : getLinksFor(ref)) {
            if (removeLink(l.getId())) removed++;
        }
        store.delete(KvKeys.byEntity(ref));
        return removed;
    }

    public RelationshipGraph getRelationshipGraph(EntityRef ref) {
        return buildGraph(ref.id(), ref.type().key(), getLinksFor(ref), l -> ref.equals(l.getSource()));
    }

    /**
     * Graph for an id whose type may be unknown; without a type every entity type is searched.
     */
    public RelationshipGraph getRelationshipGraph(String id, EntityType type) {
        if (id == null || id.isBlank()) throw new ValidationException("Entity id must not be blank");
        if (type != null) return getRelationshipGraph(EntityRef.of(type, id));
        Map<String, Link> links = new LinkedHashMap<>();
        for (EntityType t : EntityType.values()) {
            getLinksFor(EntityRef.of(t, id)).forEach(l -> links.putIfAbsent(l.getId(), l));
        }
        return buildGraph(id, null, new ArrayList<>(links.values()), l -> id.equals(l.getSource().id()));
    }

    private RelationshipGraph buildGraph(String id, String type, List<Link> links,
                                         Predicate<Link> isOutgoing) {
        Map<String, List<Link>> outgoing = new LinkedHashMap<>();
        Map<String, List<Link>> incoming = new LinkedHashMap<>();
        Map<String, Set<String>> counterparts = new LinkedHashMap<>();
        for (Link l : links) {
            boolean out = isOutgoing.test(l);
            EntityRef other = out ? l.getTarget() : l.getSource();
            String group = other.type().key();
            (out ? outgoing : incoming).computeIfAbsent(group, k -> new ArrayList<>()).add(l);
            counterparts.computeIfAbsent(group, k -> new LinkedHashSet<>()).add(other.id());
        }
        Map<String, List<String>> ids = new LinkedHashMap<>();
        counterparts.forEach((k, v) -> ids.put(k, List.copyOf(v)));
        return new RelationshipGraph(id, type, outgoing, incoming, ids);
    }

    private List<Link> fetch(List<String> ids) {
        if (ids.isEmpty()) return List.of();
        List<String> keys = ids.stream().map(KvKeys::link).toList();
        Map<String, String> found = store.mGet(keys);
        List<Link> out = new ArrayList<>(found.size());
        for (String k : keys) {
            String json = found.get(k);
            if (json == null) {
                Log.debugf("Dangling link index entry %s", k);
                continue;
            }
            out.add(codec.read(json, Link.class));
        }
        return out;
    }
}
