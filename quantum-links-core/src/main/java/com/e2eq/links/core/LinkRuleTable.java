package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;

import java.util.*;

/**
 * The declarative rule table: one {@link LinkRule} per link type plus the ordered list of
 * {@link DirectionalRule}s. Lookup is total; a link type without an entry ignores everything.
 */
public class LinkRuleTable {

    private final Map<LinkType, LinkRule> rules;
    private final List<DirectionalRule> directionalRules;

    public LinkRuleTable(Collection<LinkRule> rules, List<DirectionalRule> directionalRules) {
        Map<LinkType, LinkRule> byType = new LinkedHashMap<>();
        for (LinkRule r : rules == null ? List.<LinkRule>of() : rules) {
            if (r.linkType() == null) {
                throw new ValidationException("Link rule without a link type");
            }
            if (byType.putIfAbsent(r.linkType(), r) != null) {
                throw new ValidationException("Duplicate link rule for " + r.linkType());
            }
        }
        this.rules = Collections.unmodifiableMap(byType);
        this.directionalRules = directionalRules == null ? List.of() : List.copyOf(directionalRules);
    }

    public static LinkRuleTable empty() {
        return new LinkRuleTable(List.of(), List.of());
    }

    public LinkRule ruleFor(LinkType linkType) {
        LinkRule r = rules.get(linkType);
        return r != null ? r : LinkRule.ignoreAll(linkType);
    }

    public boolean hasRule(LinkType linkType) {
        return rules.containsKey(linkType);
    }

    /** Rules in declaration order. */
    public List<LinkRule> rules() {
        return List.copyOf(rules.values());
    }

    public List<DirectionalRule> directionalRules() {
        return directionalRules;
    }

    /** Directional rules for one link type and trigger, in declaration order. */
    public List<DirectionalRule> directionalRulesFor(LinkType linkType, LifecycleEvent trigger) {
        List<DirectionalRule> out = new ArrayList<>();
        for (DirectionalRule r : directionalRules) {
            if (r.linkType() == linkType && r.trigger() == trigger) out.add(r);
        }
        return out;
    }
}
