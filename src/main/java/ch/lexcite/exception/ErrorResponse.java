package ch.lexcite.exception;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Problem details body (RFC 9457) returned by every exception mapper.
 *
 * @param type        stable URN identifying the failure kind
 * @param title       short summary of the failure kind
 * @param status      HTTP status code
 * @param detail      explanation specific to this occurrence
 * @param instance    request path
 * @param errors      validation errors, citation failures only
 * @param suggestions corrected citations to try, citation failures only
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record ErrorResponse(
    String type,
    String title,
    int status,
    String detail,
    String instance,
    List<String> errors,
    List<String> suggestions
) {

    static final String TYPE_PREFIX = "urn:lexcite:error:";

    public ErrorResponse(String type, String title, int status, String detail, String instance) {
        this(type, title, status, detail, instance, List.of(), List.of());
    }

    static String type(String slug) {
        return TYPE_PREFIX + slug;
    }
}
