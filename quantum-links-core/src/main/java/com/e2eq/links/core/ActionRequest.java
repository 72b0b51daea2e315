package com.e2eq.links.core;

/**
 * A matched directional rule handed to the {@link ActionHandler} of {@code targetType}.
 */
public record ActionRequest(
        DirectionalRule rule,
        LifecycleEvent event,
        LinkSide subjectSide,
        EntityType targetType,
        TriggerContext context
) {

    public RuleAction action() {
        return rule.action();
    }

    public LinkType linkType() {
        return rule.linkType();
    }

    public LinkableEntity subject() {
        return context.subject();
    }

    /** The subject cast to its concrete type. */
    public <T extends LinkableEntity> T subjectAs(Class<T> type) {
        return type.cast(context.subject());
    }
}
