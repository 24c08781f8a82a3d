package ch.lexcite.client;

import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.net.SocketTimeoutException;
import java.time.Duration;

import org.junit.jupiter.api.Test;

class TransientFailurePredicateTest {

    private final TransientFailurePredicate predicate = new TransientFailurePredicate();

    @Test
    void retriesServerErrorsAndTimeouts() {
        assertTrue(predicate.test(ExternalServiceException.httpError("federal", "search", 502, null)));
        assertTrue(predicate.test(ExternalServiceException.timeout("federal", "search", null)));
        assertTrue(predicate.test(new SocketTimeoutException("read timed out")));
    }

    @Test
    void neverRetriesClientErrors() {
        assertFalse(predicate.test(ExternalServiceException.rateLimited("federal", "search", Duration.ofSeconds(5))));
        assertFalse(predicate.test(ExternalServiceException.notFound("federal", "getById")));
        assertFalse(predicate.test(ExternalServiceException.authentication("federal", "search", 401)));
        assertFalse(predicate.test(ExternalServiceException.httpError("federal", "search", 400, "bad query")));
    }

    @Test
    void nullIsNotRetried() {
        assertFalse(predicate.test(null));
    }
}
