package ch.lexcite.exception;

import org.jboss.logging.Logger;

import ch.lexcite.client.ExternalServiceException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps failures of external legal sources by kind.
 *
 * <p>Rate limiting is answered with 429 and a {@code Retry-After} header when the
 * source sent one; authentication failures with 401; not found with 404;
 * timeouts with 504 and every other failure with 502.</p>
 */
@Provider
public class ExternalServiceExceptionMapper implements ExceptionMapper<ExternalServiceException> {

    private static final Logger LOG = Logger.getLogger(ExternalServiceExceptionMapper.class);

    private static final int TOO_MANY_REQUESTS = 429;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final ExternalServiceException exception) {
        final int status = statusOf(exception);
        LOG.warnf("%s failed on %s (%s): %s", exception.service(), uriInfo.getPath(), exception.kind().slug(),
            exception.getMessage());

        final ErrorResponse error = new ErrorResponse(
            ErrorResponse.type(exception.kind().slug()),
            titleOf(exception),
            status,
            exception.getMessage(),
            uriInfo.getPath()
        );

        final Response.ResponseBuilder builder = Response.status(status)
                .entity(error)
                .type("application/problem+json");
        exception.retryAfter().ifPresent(wait -> builder.header(HttpHeaders.RETRY_AFTER,
            Math.max(1, wait.toSeconds())));
        return builder.build();
    }

    static int statusOf(final ExternalServiceException exception) {
        switch (exception.kind()) {
            case RATE_LIMITED:
                return TOO_MANY_REQUESTS;
            case AUTHENTICATION:
                return Response.Status.UNAUTHORIZED.getStatusCode();
            case NOT_FOUND:
                return Response.Status.NOT_FOUND.getStatusCode();
            case TIMEOUT:
                return Response.Status.GATEWAY_TIMEOUT.getStatusCode();
            default:
                return Response.Status.BAD_GATEWAY.getStatusCode();
        }
    }

    private static String titleOf(final ExternalServiceException exception) {
        switch (exception.kind()) {
            case RATE_LIMITED:
                return "Source Rate Limit Exceeded";
            case AUTHENTICATION:
                return "Source Authentication Failed";
            case NOT_FOUND:
                return "Not Found";
            case TIMEOUT:
                return "Source Timeout";
            default:
                return "Source Unavailable";
        }
    }
}
