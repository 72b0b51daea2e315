package com.e2eq.links.core;

import com.e2eq.links.exceptions.ValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Loads a {@link LinkRuleTable} from YAML. Policy, direction, trigger and action values are
 * case-insensitive ({@code cascade}, {@code create_target}, ...).
 */
public final class YamlLinkRuleLoader {

    // DTOs mirroring YAML
    public record YRuleTable(Integer version, List<YLinkRule> rules, List<YDirectionalRule> directional) {}
    public record YLinkRule(String linkType, String onSourceDelete, String onTargetDelete,
                            String onSourceUpdate, String onTargetUpdate) {}
    public record YDirectionalRule(String linkType, String direction, String trigger, String action,
                                   YConditions conditions) {}
    public record YConditions(String sourceStatus, String targetStatus, Map<String, Object> metadata) {}

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory());

    public LinkRuleTable loadFromClasspath(String resourcePath) throws IOException {
        try (InputStream in = getClass().getResourceAsStream(resourcePath)) {
            if (in == null) throw new IOException("Resource not found: " + resourcePath);
            return toTable(mapper.readValue(in, YRuleTable.class));
        }
    }

    public LinkRuleTable loadFromPath(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return toTable(mapper.readValue(in, YRuleTable.class));
        }
    }

    public LinkRuleTable load(InputStream in) throws IOException {
        return toTable(mapper.readValue(in, YRuleTable.class));
    }

    private LinkRuleTable toTable(YRuleTable y) {
        if (y == null) return LinkRuleTable.empty();
        List<LinkRule> rules = new ArrayList<>();
        for (YLinkRule r : Optional.ofNullable(y.rules()).orElse(List.of())) {
            LinkType type = LinkType.parse(r.linkType());
            rules.add(new LinkRule(type,
                    parse(DeletePolicy.class, r.onSourceDelete(), type),
                    parse(DeletePolicy.class, r.onTargetDelete(), type),
                    parse(UpdatePolicy.class, r.onSourceUpdate(), type),
                    parse(UpdatePolicy.class, r.onTargetUpdate(), type)));
        }
        List<DirectionalRule> directional = new ArrayList<>();
        for (YDirectionalRule d : Optional.ofNullable(y.directional()).orElse(List.of())) {
            LinkType type = LinkType.parse(d.linkType());
            RuleDirection direction = parse(RuleDirection.class, d.direction(), type);
            LifecycleEvent trigger = parse(LifecycleEvent.class, d.trigger(), type);
            RuleAction action = parse(RuleAction.class, d.action(), type);
            if (direction == null || trigger == null || action == null) {
                throw new ValidationException("Directional rule for " + type + " needs direction, trigger and action");
            }
            directional.add(new DirectionalRule(type, direction, trigger, action, toConditions(d.conditions())));
        }
        return new LinkRuleTable(rules, directional);
    }

    private static List<RuleCondition> toConditions(YConditions c) {
        if (c == null) return List.of();
        List<RuleCondition> out = new ArrayList<>();
        if (c.sourceStatus() != null) out.add(new RuleCondition.StatusEquals(LinkSide.SOURCE, c.sourceStatus()));
        if (c.targetStatus() != null) out.add(new RuleCondition.StatusEquals(LinkSide.TARGET, c.targetStatus()));
        if (c.metadata() != null && !c.metadata().isEmpty()) out.add(new RuleCondition.MetadataSubset(c.metadata()));
        return out;
    }

    private static <E extends Enum<E>> E parse(Class<E> type, String value, LinkType linkType) {
        if (value == null || value.isBlank()) return null;
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException iae) {
            throw new ValidationException("Unknown " + type.getSimpleName() + " '" + value + "' for " + linkType
                    + ". Expected one of: " + Arrays.toString(type.getEnumConstants()));
        }
    }
}
