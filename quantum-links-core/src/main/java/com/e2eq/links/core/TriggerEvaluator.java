package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;
import io.quarkus.logging.Log;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Matches a lifecycle event on one end of a link type against the directional rules and
 * dispatches every match, in declaration order, to the handler of the entity type on the other
 * end. Handler exceptions propagate to the caller.
 */
public class TriggerEvaluator {

    private final LinkRuleTable ruleTable;
    private final ActionHandlerRegistry handlers;

    public TriggerEvaluator(LinkRuleTable ruleTable, ActionHandlerRegistry handlers) {
        this.ruleTable = ruleTable;
        this.handlers = handlers;
    }

    public TriggerResult evaluate(LinkType linkType, LifecycleEvent event, TriggerContext context) {
        if (linkType == null || event == null || context == null || context.subject() == null) {
            throw new ValidationException("Trigger evaluation needs a link type, an event and a subject");
        }
        LinkableEntity subject = context.subject();
        LinkSide side = sideOf(linkType, context);
        ConditionMatcher.Snapshot snapshot = snapshot(side, context);

        List<DirectionalRule> fired = new ArrayList<>();
        List<DirectionalRule> unhandled = new ArrayList<>();
        for (DirectionalRule rule : ruleTable.directionalRulesFor(linkType, event)) {
            if (!rule.direction().accepts(side)) continue;
            if (!ConditionMatcher.matchesAll(rule.conditions(), snapshot)) continue;

            EntityType targetType = side == LinkSide.SOURCE ? linkType.targetType() : linkType.sourceType();
            Optional<ActionHandler> handler = handlers.handlerFor(targetType);
            if (handler.isEmpty()) {
                Log.warnf("No action handler for %s; %s %s on %s not applied", targetType.key(), linkType, rule.action(), subject.ref());
                unhandled.add(rule);
                continue;
            }
            Log.debugf("Rule %s %s %s fired for %s", linkType, event, rule.action(), subject.ref());
            handler.get().handle(new ActionRequest(rule, event, side, targetType, context));
            fired.add(rule);
        }
        return new TriggerResult(linkType, event, fired, unhandled);
    }

    private static LinkSide sideOf(LinkType linkType, TriggerContext context) {
        EntityRef subjectRef = context.subject().ref();
        if (context.link() != null) {
            return LinkSide.of(context.link(), subjectRef);
        }
        if (subjectRef.type() == linkType.sourceType()) return LinkSide.SOURCE;
        if (subjectRef.type() == linkType.targetType()) return LinkSide.TARGET;
        throw new ValidationException(subjectRef + " cannot take part in a " + linkType + " link");
    }

    private static ConditionMatcher.Snapshot snapshot(LinkSide side, TriggerContext context) {
        LinkableEntity source = side == LinkSide.SOURCE ? context.subject() : context.counterpart();
        LinkableEntity target = side == LinkSide.SOURCE ? context.counterpart() : context.subject();
        Map<String, Object> metadata = source != null ? source.triggerMetadata() : Map.of();
        return new ConditionMatcher.Snapshot(
                source != null ? source.lifecycleStatus() : null,
                target != null ? target.lifecycleStatus() : null,
                metadata);
    }
}
