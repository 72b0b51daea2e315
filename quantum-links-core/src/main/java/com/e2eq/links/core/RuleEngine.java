package com.e2eq.links.core;

import com.e2eq.links.exceptions.BlockedDeletionException;
import com.e2eq.links.exceptions.DepthExceededException;
import io.quarkus.logging.Log;

import java.util.*;

/**
 * Resolves delete and update policies for the links touching an entity.
 *
 * <p>Links are evaluated grouped by link type, groups in the order their first link was fetched
 * (reverse index insertion order). Nothing beyond that ordering is guaranteed.</p>
 */
public class RuleEngine {

    private final LinkRuleTable ruleTable;
    private final LinkRegistry registry;
    private final TriggerEvaluator triggerEvaluator;
    private final EntityResolver resolver;
    private final int maxCascadeDepth;

    public RuleEngine(LinkRuleTable ruleTable, LinkRegistry registry, TriggerEvaluator triggerEvaluator,
                      EntityResolver resolver, int maxCascadeDepth) {
        this.ruleTable = ruleTable;
        this.registry = registry;
        this.triggerEvaluator = triggerEvaluator;
        this.resolver = resolver;
        this.maxCascadeDepth = maxCascadeDepth;
    }

    /**
     * Plans the deletion of {@code root}: the cascade closure as a breadth-first worklist, then
     * prompt and block policies toward entities outside that closure.
     *
     * @throws BlockedDeletionException if any {@code block} policy applies; nothing is mutated
     * @throws DepthExceededException if the cascade goes deeper than the configured maximum
     */
    public DeletePlan planDelete(EntityRef root) {
        Map<EntityRef, Integer> depthOf = new LinkedHashMap<>();
        Map<EntityRef, List<Link>> linksOf = new LinkedHashMap<>();
        List<DeletePlan.CascadeStep> cascades = new ArrayList<>();
        Deque<EntityRef> worklist = new ArrayDeque<>();
        depthOf.put(root, 0);
        worklist.add(root);

        while (!worklist.isEmpty()) {
            EntityRef ref = worklist.poll();
            int depth = depthOf.get(ref);
            List<Link> links = groupByType(registry.getLinksFor(ref));
            linksOf.put(ref, links);
            for (Link link : links) {
                LinkSide side = LinkSide.of(link, ref);
                if (ruleTable.ruleFor(link.getLinkType()).onDelete(side) != DeletePolicy.CASCADE) continue;
                EntityRef other = side.counterpart(link);
                if (depthOf.containsKey(other)) continue;
                if (depth + 1 > maxCascadeDepth) {
                    throw new DepthExceededException(other.key(), maxCascadeDepth,
                            depthOf.keySet().stream().map(EntityRef::key).toList());
                }
                depthOf.put(other, depth + 1);
                worklist.add(other);
                cascades.add(new DeletePlan.CascadeStep(ref, other, link, depth + 1));
            }
        }

        List<Link> blockers = new ArrayList<>();
        List<DecisionNeeded> decisions = new ArrayList<>();
        linksOf.forEach((ref, links) -> {
            for (Link link : links) {
                LinkSide side = LinkSide.of(link, ref);
                EntityRef other = side.counterpart(link);
                if (depthOf.containsKey(other)) continue;
                DeletePolicy policy = ruleTable.ruleFor(link.getLinkType()).onDelete(side);
                if (policy == DeletePolicy.BLOCK) {
                    blockers.add(link);
                } else if (policy == DeletePolicy.PROMPT) {
                    decisions.add(new DecisionNeeded(DecisionNeeded.Kind.DELETE, ref, other, link));
                }
            }
        });
        if (!blockers.isEmpty()) {
            Log.infof("Deletion of %s blocked by %d link(s)", root, blockers.size());
            throw new BlockedDeletionException(root, blockers);
        }
        Log.infof("Delete plan for %s: %d cascade(s), %d decision(s)", root, cascades.size(), decisions.size());
        return new DeletePlan(root, cascades, decisions);
    }

    /**
     * Applies update policies for the links touching {@code updated}. {@code propagate} re-runs
     * the trigger evaluator with {@link LifecycleEvent#UPDATE} toward the counterpart.
     */
    public UpdateOutcome propagateUpdate(LinkableEntity updated, LinkableEntity previous) {
        EntityRef ref = updated.ref();
        List<TriggerResult> propagated = new ArrayList<>();
        List<DecisionNeeded> decisions = new ArrayList<>();
        for (Link link : groupByType(registry.getLinksFor(ref))) {
            LinkSide side = LinkSide.of(link, ref);
            EntityRef other = side.counterpart(link);
            UpdatePolicy policy = ruleTable.ruleFor(link.getLinkType()).onUpdate(side);
            if (policy == UpdatePolicy.PROPAGATE) {
                LinkableEntity counterpart = resolver.resolve(other).orElse(null);
                TriggerResult r = triggerEvaluator.evaluate(link.getLinkType(), LifecycleEvent.UPDATE,
                        new TriggerContext(updated, previous, counterpart, link));
                if (r.triggered()) propagated.add(r);
            } else if (policy == UpdatePolicy.PROMPT) {
                decisions.add(new DecisionNeeded(DecisionNeeded.Kind.UPDATE, ref, other, link));
            }
        }
        return new UpdateOutcome(propagated, decisions);
    }

    static List<Link> groupByType(List<Link> links) {
        Map<LinkType, List<Link>> groups = new LinkedHashMap<>();
        for (Link l : links) {
            groups.computeIfAbsent(l.getLinkType(), k -> new ArrayList<>()).add(l);
        }
        List<Link> out = new ArrayList<>(links.size());
        groups.values().forEach(out::addAll);
        return out;
    }
}
