package ch.lexcite.client;

import java.time.temporal.ChronoUnit;

import org.eclipse.microprofile.faulttolerance.Retry;

import ch.lexcite.utils.RetryEventLogger;
import io.smallrye.faulttolerance.api.ExponentialBackoff;
import io.smallrye.faulttolerance.api.RetryWhen;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Runs source calls under the shared retry policy.
 *
 * <p>Up to three retries with exponential backoff (1 s, doubling, at most 10 s)
 * inside a 60 s budget. Each attempt queues for a turn in the source's
 * {@link RequestThrottle}; once the turn comes, the request itself is bounded
 * by the {@link TimedAttempt} timeout. Only failures accepted by
 * {@link TransientFailurePredicate} are retried.</p>
 */
@ApplicationScoped
public class ResilientInvoker {

    @Inject
    RetryEventLogger retryEventLogger;

    @Inject
    TimedAttempt timedAttempt;

    @Retry(maxRetries = 3, delay = 1, delayUnit = ChronoUnit.SECONDS, maxDuration = 60, durationUnit = ChronoUnit.SECONDS)
    @ExponentialBackoff(factor = 2, maxDelay = 10, maxDelayUnit = ChronoUnit.SECONDS)
    @RetryWhen(exception = TransientFailurePredicate.class)
    public <T> T call(SourceCall<T> call) {
        int attempt = call.startAttempt();
        if (attempt > 1) {
            retryEventLogger.logRetryAttempt(call.operationName(), attempt, call.lastFailure());
        }
        try {
            return call.throttle().execute(() -> timedAttempt.run(call.request()));
        } catch (RuntimeException e) {
            call.recordFailure(e);
            throw e;
        }
    }
}
