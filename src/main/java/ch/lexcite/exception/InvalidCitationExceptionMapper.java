package ch.lexcite.exception;

import ch.lexcite.citation.InvalidCitationException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

/**
 * Maps InvalidCitationException to 422 with the parse errors and correction suggestions.
 */
@Provider
public class InvalidCitationExceptionMapper implements ExceptionMapper<InvalidCitationException> {

    private static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final InvalidCitationException exception) {
        final ErrorResponse error = new ErrorResponse(
            ErrorResponse.type("invalid-citation"),
            "Invalid Citation",
            UNPROCESSABLE_ENTITY,
            exception.getMessage(),
            uriInfo.getPath(),
            exception.parsed().errors(),
            exception.suggestions()
        );

        return Response.status(UNPROCESSABLE_ENTITY)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
