package ch.lexcite.exception;

import ch.lexcite.citation.CitationFormatException;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.core.UriInfo;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;

@Provider
public class CitationFormatExceptionMapper implements ExceptionMapper<CitationFormatException> {

    private static final int UNPROCESSABLE_ENTITY = 422;

    @Context
    UriInfo uriInfo;

    @Override
    public Response toResponse(final CitationFormatException exception) {
        final ErrorResponse error = new ErrorResponse(
            ErrorResponse.type("unformattable-citation"),
            "Citation Cannot Be Formatted",
            UNPROCESSABLE_ENTITY,
            exception.getMessage(),
            uriInfo.getPath()
        );

        return Response.status(UNPROCESSABLE_ENTITY)
                .entity(error)
                .type("application/problem+json")
                .build();
    }
}
