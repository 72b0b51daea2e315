package com.e2eq.links.rest.dto;

import com.e2eq.links.core.EntityRef;

import java.util.Map;

public record CreateLinkRequest(String linkType, EntityRef source, EntityRef target, Map<String, Object> metadata) {
}
