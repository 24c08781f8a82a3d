package ch.lexcite.client;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

import org.jetbrains.annotations.Nullable;

/**
 * Failure of a call to an external legal data source.
 *
 * <p>This is the only exception type that leaves a source client. Transport
 * exceptions are kept as the cause.</p>
 */
public class ExternalServiceException extends RuntimeException {

    private final FailureKind kind;
    private final String service;
    private final String endpoint;
    private final Integer status;
    private final Duration retryAfter;
    private final boolean noResponse;

    public ExternalServiceException(FailureKind kind, String service, @Nullable String endpoint, @Nullable Integer status,
            @Nullable Duration retryAfter, String message, @Nullable Throwable cause) {
        this(kind, service, endpoint, status, retryAfter, false, message, cause);
    }

    private ExternalServiceException(FailureKind kind, String service, @Nullable String endpoint, @Nullable Integer status,
            @Nullable Duration retryAfter, boolean noResponse, String message, @Nullable Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.service = service;
        this.endpoint = endpoint;
        this.status = status;
        this.retryAfter = retryAfter;
        this.noResponse = noResponse;
    }

    public static ExternalServiceException rateLimited(String service, @Nullable String endpoint, @Nullable Duration retryAfter) {
        String hint = retryAfter == null ? "" : ", retry after " + retryAfter.toSeconds() + "s";
        return new ExternalServiceException(FailureKind.RATE_LIMITED, service, endpoint, 429, retryAfter,
            service + " rate limit exceeded" + at(endpoint) + hint, null);
    }

    public static ExternalServiceException authentication(String service, @Nullable String endpoint, int status) {
        return new ExternalServiceException(FailureKind.AUTHENTICATION, service, endpoint, status, null,
            service + " rejected the credentials" + at(endpoint) + " (HTTP " + status + ")", null);
    }

    public static ExternalServiceException notFound(String service, @Nullable String endpoint) {
        return new ExternalServiceException(FailureKind.NOT_FOUND, service, endpoint, 404, null,
            service + " has no such resource" + at(endpoint), null);
    }

    public static ExternalServiceException timeout(String service, @Nullable String endpoint, @Nullable Throwable cause) {
        return new ExternalServiceException(FailureKind.TIMEOUT, service, endpoint, null, null,
            service + " timed out" + at(endpoint), cause);
    }

    public static ExternalServiceException httpError(String service, @Nullable String endpoint, int status, @Nullable String body) {
        String detail = body == null || body.isBlank() ? "" : " - " + body;
        return new ExternalServiceException(FailureKind.GENERIC, service, endpoint, status, null,
            service + " returned HTTP " + status + at(endpoint) + detail, null);
    }

    /**
     * The request never produced a response: connection refused, reset or closed.
     */
    public static ExternalServiceException noResponse(String service, @Nullable String endpoint, Throwable cause) {
        return new ExternalServiceException(FailureKind.GENERIC, service, endpoint, null, null, true,
            service + " did not respond" + at(endpoint) + ": " + cause.getMessage(), cause);
    }

    /**
     * Any other failure, such as an unreadable response body.
     */
    public static ExternalServiceException generic(String service, @Nullable String endpoint, Throwable cause) {
        return new ExternalServiceException(FailureKind.GENERIC, service, endpoint, null, null,
            service + " call failed" + at(endpoint) + ": " + cause.getMessage(), cause);
    }

    private static String at(@Nullable String endpoint) {
        return endpoint == null ? "" : " on " + endpoint;
    }

    /**
     * Returns a copy with the endpoint replaced, keeping every other property.
     */
    ExternalServiceException withEndpoint(String newEndpoint) {
        ExternalServiceException copy = new ExternalServiceException(kind, service, newEndpoint, status, retryAfter,
            noResponse, getMessage(), getCause());
        copy.setStackTrace(getStackTrace());
        return copy;
    }

    public FailureKind kind() {
        return kind;
    }

    public String service() {
        return service;
    }

    @Nullable
    public String endpoint() {
        return endpoint;
    }

    public Optional<Integer> status() {
        return Optional.ofNullable(status);
    }

    public Optional<Duration> retryAfter() {
        return Optional.ofNullable(retryAfter);
    }

    /**
     * Transient failures are worth retrying: timeouts, 5xx responses and
     * requests that got no response. Client errors (4xx, 429 included) are permanent.
     */
    public boolean isTransient() {
        switch (kind) {
            case TIMEOUT:
                return true;
            case GENERIC:
                return noResponse || (status != null && status >= 500);
            default:
                return false;
        }
    }
}
