package ch.lexcite.client;

/**
 * Closed set of failure kinds for calls to external sources.
 * Every transport or HTTP failure is mapped to exactly one kind.
 */
public enum FailureKind {

    /** HTTP 429. May carry a retry-after hint. */
    RATE_LIMITED("rate-limited"),

    /** HTTP 401 or 403. */
    AUTHENTICATION("authentication"),

    /** HTTP 404. Lookups turn this into a not-found result. */
    NOT_FOUND("not-found"),

    /** Connect, read or per-attempt timeout. */
    TIMEOUT("timeout"),

    /** Any other failure, including 5xx responses and lost connections. */
    GENERIC("generic");

    private final String slug;

    FailureKind(String slug) {
        this.slug = slug;
    }

    public String slug() {
        return slug;
    }
}
