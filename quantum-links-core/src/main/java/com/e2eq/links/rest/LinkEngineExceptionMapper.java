package com.e2eq.links.rest;

import com.e2eq.links.exceptions.*;
import com.e2eq.links.rest.dto.LinkErrorResponse;
import io.quarkus.logging.Log;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

import java.util.List;

/**
 * Maps the link engine's exceptions to HTTP responses.
 */
@Provider
public class LinkEngineExceptionMapper implements ExceptionMapper<LinkEngineException> {

    static final int LOOP_DETECTED = 508;

    @Override
    public Response toResponse(LinkEngineException exception) {
        LinkErrorResponse.LinkErrorResponseBuilder body = LinkErrorResponse.builder()
                .errorType(exception.getClass().getSimpleName())
                .statusMessage(exception.getMessage());
        int status;
        if (exception instanceof ValidationException) {
            status = Response.Status.BAD_REQUEST.getStatusCode();
            body.reasonMessage("The request was not valid");
        } else if (exception instanceof NotFoundException nf) {
            status = Response.Status.NOT_FOUND.getStatusCode();
            body.reasonMessage("No record found").entity(nf.getEntityType() + ":" + nf.getEntityId());
        } else if (exception instanceof BlockedDeletionException bd) {
            status = Response.Status.CONFLICT.getStatusCode();
            body.reasonMessage("Deletion is blocked by linked records")
                    .entity(bd.getEntity().key())
                    .details(bd.getBlockingLinks().stream().map(l -> l.getLinkType() + ":" + l.getId()).toList());
        } else if (exception instanceof CircularReferenceException cr) {
            status = LOOP_DETECTED;
            body.reasonMessage("Circular workflow propagation").entity(cr.getKey()).details(cr.getStack());
        } else if (exception instanceof DepthExceededException de) {
            status = LOOP_DETECTED;
            body.reasonMessage("Workflow propagation too deep").entity(de.getKey()).details(de.getStack());
        } else if (exception instanceof SideEffectsIncompleteException si) {
            status = Response.Status.ACCEPTED.getStatusCode();
            body.reasonMessage("Saved, but side effects are incomplete; retry to converge")
                    .entity(si.getEntity().key())
                    .details(si.getCause() != null ? List.of(String.valueOf(si.getCause().getMessage())) : null);
        } else {
            status = Response.Status.INTERNAL_SERVER_ERROR.getStatusCode();
            body.reasonMessage("Link engine failure");
        }

        if (status >= 500 && status != LOOP_DETECTED) {
            Log.errorf(exception, "Link engine error: %s", exception.getMessage());
        } else if (status == LOOP_DETECTED || status == Response.Status.ACCEPTED.getStatusCode()) {
            Log.warnf("Link engine: %s", exception.getMessage());
        } else {
            Log.debugf("Link engine client error: %s", exception.getMessage());
        }
        return Response.status(status).entity(body.status(status).build()).build();
    }
}
