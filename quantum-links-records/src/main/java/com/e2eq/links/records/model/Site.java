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

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@RegisterForReflection
public class Site implements LinkableEntity {

    public static final String HEADQUARTERS = "hq";

    private String id;
    private String name;

    @LinkedBy(LinkType.SITE_SITE)
    private String parentSiteId;

    @Override
    public EntityType entityType() {
        return EntityType.SITE;
    }
}
