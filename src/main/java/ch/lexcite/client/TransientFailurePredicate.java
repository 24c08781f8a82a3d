package ch.lexcite.client;

import java.util.function.Predicate;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides whether a failed source call is retried.
 *
 * <p>Timeouts, 5xx responses and requests that got no response are retried.
 * Client errors, including 429, are permanent.</p>
 */
public final class TransientFailurePredicate implements Predicate<Throwable> {

    private static final Logger logger = LoggerFactory.getLogger(TransientFailurePredicate.class);

    @Override
    public boolean test(final Throwable throwable) {
        if (throwable == null) {
            return false;
        }
        ExternalServiceException failure = ExternalFailureClassifier.classify(throwable, "source", "call");
        boolean retry = failure.isTransient();
        logger.debug("{} classified as {} ({})", throwable.getClass().getSimpleName(), failure.kind(),
            retry ? "transient" : "permanent");
        return retry;
    }
}
