package com.e2eq.links.records.model;

import com.e2eq.links.annotations.LinkedBy;
import com.e2eq.links.core.EntityType;
import com.e2eq.links.core.LinkType;
import com.e2eq.links.core.LinkableEntity;
import io.quarkus.runtime.annotations.RegisterForReflection;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * A person the business deals with: customer, supplier, team member.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class CharacterRecord implements LinkableEntity {

    public static final String ROLE_CUSTOMER = "customer";

    private String id;
    private String name;

    @Builder.Default
    private List<String> roles = new ArrayList<>();

    @LinkedBy(LinkType.CHARACTER_PLAYER)
    private String playerId;

    @LinkedBy(LinkType.CHARACTER_SITE)
    private String siteId;

    private Instant lastActiveAt;

    /** Id of the character created from a task's new-customer name. */
    public static String customerOf(String taskId) {
        return "character-" + taskId + "-customer";
    }

    @Override
    public EntityType entityType() {
        return EntityType.CHARACTER;
    }
}
