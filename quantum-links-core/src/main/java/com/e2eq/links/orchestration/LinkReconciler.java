package com.e2eq.links.orchestration;

import com.e2eq.links.core.*;
import com.e2eq.links.spi.LinkProvider;
import io.quarkus.logging.Log;

import java.math.BigDecimal;
import java.util.*;

/**
 * Brings an entity's outgoing links in line with its relationship-bearing fields: creates
 * missing links, updates changed metadata and removes links whose field was cleared. Only link
 * types owned by a {@link com.e2eq.links.annotations.LinkedBy} member or a {@link LinkProvider} are ever removed, so links
 * created by other paths survive.
 */
public class LinkReconciler {

    private final LinkRegistry registry;
    private final AnnotatedLinkExtractor extractor;
    private final List<LinkProvider> providers;

    public LinkReconciler(LinkRegistry registry, AnnotatedLinkExtractor extractor, List<LinkProvider> providers) {
        this.registry = registry;
        this.extractor = extractor;
        this.providers = providers == null ? List.of() : List.copyOf(providers);
    }

    public ReconcileResult reconcile(LinkableEntity entity) {
        EntityRef ref = entity.ref();
        Set<LinkType> managed = EnumSet.noneOf(LinkType.class);
        managed.addAll(extractor.linkTypesOf(entity.getClass()));

        Map<String, DesiredLink> desired = new LinkedHashMap<>();
        extractor.extract(entity).forEach(d -> desired.putIfAbsent(keyOf(d.linkType(), d.target()), d));
        for (LinkProvider p : providers) {
            if (!p.supports(entity.entityType())) continue;
            managed.addAll(p.linkTypes());
            for (DesiredLink d : p.links(entity)) {
                desired.putIfAbsent(keyOf(d.linkType(), d.target()), d);
            }
        }

        Map<String, Link> existing = new LinkedHashMap<>();
        for (Link l : registry.getLinksFor(ref)) {
            if (ref.equals(l.getSource()) && managed.contains(l.getLinkType())) {
                existing.putIfAbsent(keyOf(l.getLinkType(), l.getTarget()), l);
            }
        }

        int created = 0, updated = 0, removed = 0;
        for (Map.Entry<String, DesiredLink> e : desired.entrySet()) {
            DesiredLink d = e.getValue();
            Link current = existing.remove(e.getKey());
            if (current == null) {
                if (registry.createLink(Link.of(d.linkType(), ref, d.target(), d.metadata()))) created++;
            } else if (!sameMetadata(current.getMetadata(), d.metadata())) {
                registry.updateLinkMetadata(current.getId(), d.metadata());
                updated++;
            }
        }
        for (Link stale : existing.values()) {
            if (registry.removeLink(stale.getId())) removed++;
        }
        if (created + updated + removed > 0) {
            Log.debugf("Links reconciled for %s: +%d ~%d -%d", ref, created, updated, removed);
        }
        return new ReconcileResult(created, updated, removed);
    }

    private static String keyOf(LinkType type, EntityRef target) {
        return type.name() + "|" + target.key();
    }

    // Metadata round-trips through JSON, so compare numbers by value.
    private static boolean sameMetadata(Map<String, Object> stored, Map<String, Object> wanted) {
        Map<String, Object> a = stored == null ? Map.of() : stored;
        Map<String, Object> b = wanted == null ? Map.of() : wanted;
        if (!a.keySet().equals(b.keySet())) return false;
        for (String k : a.keySet()) {
            Object x = a.get(k);
            Object y = b.get(k);
            if (x instanceof Number nx && y instanceof Number ny) {
                if (new BigDecimal(nx.toString()).compareTo(new BigDecimal(ny.toString())) != 0) return false;
            } else if (!Objects.equals(x, y)) {
                return false;
            }
        }
        return true;
    }
}
