package ch.lexcite.exception;

import org.jboss.logging.Logger;

import ch.lexcite.storage.StorageException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps StorageException to HTTP 500 Internal Server Error responses.
 */
@Provider
public class StorageExceptionMapper implements ExceptionMapper<StorageException> {

    private static final Logger LOG = Logger.getLogger(StorageExceptionMapper.class);

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final StorageException exception) {
        LOG.errorf(exception, "Storage failure on %s", uriInfo.getPath());
        final ErrorResponse error = new ErrorResponse(
            ErrorResponse.type("storage"),
            "Storage Failure",
            Response.Status.INTERNAL_SERVER_ERROR.getStatusCode(),
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
