package ch.lexcite.client;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.concurrent.TimeoutException;

import org.jetbrains.annotations.Nullable;

import jakarta.ws.rs.ProcessingException;
import jakarta.ws.rs.WebApplicationException;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.Response;

/**
 * Maps HTTP responses and transport failures onto {@link FailureKind}s.
 *
 * <p>The mapping is total: whatever is thrown, the caller gets back an
 * {@link ExternalServiceException}.</p>
 */
public final class ExternalFailureClassifier {

    private static final int MAX_CAUSE_DEPTH = 16;

    private ExternalFailureClassifier() {
    }

    /**
     * Classifies an error response.
     *
     * @param service    source name
     * @param endpoint   endpoint or operation, may be null when unknown
     * @param status     HTTP status, at least 400
     * @param retryAfter raw Retry-After header value, may be null
     * @param body       response body, may be null
     */
    public static ExternalServiceException fromStatus(String service, @Nullable String endpoint, int status,
            @Nullable String retryAfter, @Nullable String body) {
        if (status == 429) {
            return ExternalServiceException.rateLimited(service, endpoint, parseRetryAfter(retryAfter, Clock.systemUTC()));
        }
        if (status == 401 || status == 403) {
            return ExternalServiceException.authentication(service, endpoint, status);
        }
        if (status == 404) {
            return ExternalServiceException.notFound(service, endpoint);
        }
        return ExternalServiceException.httpError(service, endpoint, status, body);
    }

    /**
     * Classifies any failure raised while calling a source.
     *
     * <p>An {@link ExternalServiceException} anywhere in the cause chain is returned
     * as is, with a missing endpoint filled in from {@code operation}.</p>
     */
    public static ExternalServiceException classify(Throwable failure, String service, String operation) {
        Throwable current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof ExternalServiceException external) {
                return external.endpoint() == null ? external.withEndpoint(operation) : external;
            }
            if (current instanceof WebApplicationException web && web.getResponse() != null) {
                Response response = web.getResponse();
                if (response.getStatus() >= 400) {
                    return fromStatus(service, operation, response.getStatus(),
                        response.getHeaderString(HttpHeaders.RETRY_AFTER), null);
                }
            }
            if (isTimeout(current)) {
                return ExternalServiceException.timeout(service, operation, failure);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }

        current = failure;
        for (int depth = 0; current != null && depth < MAX_CAUSE_DEPTH; depth++) {
            if (current instanceof IOException || current instanceof ProcessingException) {
                return ExternalServiceException.noResponse(service, operation, failure);
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return ExternalServiceException.generic(service, operation, failure);
    }

    static boolean isTimeout(Throwable failure) {
        return failure instanceof SocketTimeoutException
            || failure instanceof TimeoutException
            || failure instanceof org.eclipse.microprofile.faulttolerance.exceptions.TimeoutException
            || failure.getClass().getSimpleName().contains("TimeoutException");
    }

    /**
     * Parses a Retry-After header given either in seconds or as an HTTP date.
     *
     * @return the wait, or null when absent or unparseable
     */
    @Nullable
    static Duration parseRetryAfter(@Nullable String header, Clock clock) {
        if (header == null || header.isBlank()) {
            return null;
        }
        String value = header.trim();
        try {
            long seconds = Long.parseLong(value);
            return Duration.ofSeconds(Math.max(0, seconds));
        } catch (NumberFormatException notSeconds) {
            try {
                ZonedDateTime at = ZonedDateTime.parse(value, DateTimeFormatter.RFC_1123_DATE_TIME);
                Duration wait = Duration.between(clock.instant(), at.toInstant());
                return wait.isNegative() ? Duration.ZERO : wait;
            } catch (DateTimeParseException e) {
                return null;
            }
        }
    }
}
