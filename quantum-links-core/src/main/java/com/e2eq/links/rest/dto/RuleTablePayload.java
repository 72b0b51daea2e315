package com.e2eq.links.rest.dto;

import com.e2eq.links.core.DirectionalRule;
import com.e2eq.links.core.LinkRule;

import java.util.List;

public record RuleTablePayload(List<LinkRule> rules, List<DirectionalRule> directional) {

    public RuleTablePayload {
        rules = rules == null ? List.of() : List.copyOf(rules);
        directional = directional == null ? List.of() : List.copyOf(directional);
    }
}
