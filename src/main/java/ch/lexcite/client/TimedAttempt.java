package ch.lexcite.client;

import java.time.temporal.ChronoUnit;
import java.util.function.Supplier;

import org.eclipse.microprofile.faulttolerance.Timeout;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Bounds one request attempt with a 30 s timeout.
 *
 * <p>Invoked from inside {@link RequestThrottle#execute}, so time spent waiting
 * for a turn in the rate limiter queue is not part of the attempt.</p>
 */
@ApplicationScoped
public class TimedAttempt {

    @Timeout(value = 30, unit = ChronoUnit.SECONDS)
    public <T> T run(Supplier<T> request) {
        return request.get();
    }
}
