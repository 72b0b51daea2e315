package com.e2eq.links.rest;

import com.e2eq.links.core.*;
import com.e2eq.links.exceptions.NotFoundException;
import com.e2eq.links.exceptions.ValidationException;
import com.e2eq.links.rest.dto.CreateLinkRequest;
import com.e2eq.links.rest.dto.RuleTablePayload;
import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import org.eclipse.microprofile.openapi.annotations.tags.Tag;

import java.util.List;

@Path("/links")
@RolesAllowed({"admin", "user"})
@Tag(name = "links", description = "Entity links, relationship graphs and link engine state")
@Produces(MediaType.APPLICATION_JSON)
public class LinkResource {

    private final LinkRegistry registry;
    private final ProcessingGuard guard;
    private final LinkRuleTable ruleTable;

    @Inject
    public LinkResource(LinkRegistry registry, ProcessingGuard guard, LinkRuleTable ruleTable) {
        this.registry = registry;
        this.guard = guard;
        this.ruleTable = ruleTable;
    }

    @GET
    @Path("/entity/{type}/{id}")
    public List<Link> linksFor(@PathParam("type") String type, @PathParam("id") String id) {
        return registry.getLinksFor(EntityRef.of(EntityType.fromKey(type), id));
    }

    @GET
    @Path("/graph/{type}/{id}")
    public RelationshipGraph graph(@PathParam("type") String type, @PathParam("id") String id) {
        EntityType entityType = "any".equalsIgnoreCase(type) ? null : EntityType.fromKey(type);
        return registry.getRelationshipGraph(id, entityType);
    }

    @GET
    @Path("/type/{linkType}")
    public List<Link> linksByType(@PathParam("linkType") String linkType) {
        return registry.getLinksByType(LinkType.parse(linkType));
    }

    @GET
    @Path("/{id}")
    public Link link(@PathParam("id") String id) {
        return registry.getLink(id).orElseThrow(() -> new NotFoundException("link", id));
    }

    @POST
    @Consumes(MediaType.APPLICATION_JSON)
    public Response create(CreateLinkRequest request) {
        if (request == null) {
            throw new ValidationException("Request body is required");
        }
        Link link = Link.of(LinkType.parse(request.linkType()), request.source(), request.target(), request.metadata());
        if (registry.createLink(link)) {
            return Response.status(Response.Status.CREATED).entity(link).build();
        }
        Link existing = registry.findExisting(link.getLinkType(), link.getSource(), link.getTarget()).orElse(link);
        return Response.ok(existing).build();
    }

    @DELETE
    @Path("/{id}")
    public Response remove(@PathParam("id") String id) {
        if (!registry.removeLink(id)) {
            throw new NotFoundException("link", id);
        }
        return Response.noContent().build();
    }

    @GET
    @Path("/processing")
    public ProcessingStatus processing() {
        return guard.getProcessingStatus();
    }

    @DELETE
    @Path("/processing")
    @RolesAllowed("admin")
    public Response clearProcessing() {
        guard.clearProcessingStack();
        return Response.noContent().build();
    }

    @GET
    @Path("/rules")
    public RuleTablePayload rules() {
        return new RuleTablePayload(ruleTable.rules(), ruleTable.directionalRules());
    }
}
