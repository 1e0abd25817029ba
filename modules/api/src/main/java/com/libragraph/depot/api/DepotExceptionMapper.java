package com.libragraph.depot.api;

import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import org.jboss.logging.Logger;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps storage failures to JSON error responses; see {@link ErrorStatus}.
 */
@Provider
public class DepotExceptionMapper implements ExceptionMapper<RuntimeException> {

    private static final Logger log = Logger.getLogger(DepotExceptionMapper.class);

    @Override
    public Response toResponse(RuntimeException exception) {
        if (exception instanceof WebApplicationException wae) {
            return wae.getResponse();
        }
        Throwable cause = ErrorStatus.unwrap(exception);
        Response.Status status = ErrorStatus.of(cause);
        if (status.getFamily() == Response.Status.Family.SERVER_ERROR) {
            log.errorf(cause, "Request failed: %s", cause.getMessage());
        } else {
            log.debugf("Request rejected (%d): %s", status.getStatusCode(), cause.getMessage());
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.getStatusCode());
        body.put("error", status.getReasonPhrase());
        body.put("message", String.valueOf(cause.getMessage()));
        return Response.status(status).type(MediaType.APPLICATION_JSON_TYPE).entity(body).build();
    }
}
