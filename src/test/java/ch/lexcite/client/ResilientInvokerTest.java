package ch.lexcite.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;

/**
 * Runs against the test profile, where an attempt times out after 1 s.
 */
@QuarkusTest
class ResilientInvokerTest {

    @Inject
    ResilientInvoker invoker;

    @Test
    void queuedWaitDoesNotCountAgainstAttemptTimeout() {
        // one request every 2 s
        RequestThrottle throttle = new RequestThrottle("test", 30);
        assertEquals("first", invoker.call(new SourceCall<>("test", "first", throttle, () -> "first")));

        SourceCall<String> queued = new SourceCall<>("test", "second", throttle, () -> "second");
        long start = System.nanoTime();
        String result = invoker.call(queued);
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertEquals("second", result);
        assertEquals(1, queued.attempts());
        assertTrue(elapsedMs >= 1000, "second request waited only " + elapsedMs + " ms for its turn");
    }

    @Test
    void slowRequestTimesOutAndIsRetried() {
        RequestThrottle throttle = new RequestThrottle("test", 6000);
        AtomicInteger invocations = new AtomicInteger();
        SourceCall<String> call = new SourceCall<>("test", "slow", throttle, () -> {
            if (invocations.incrementAndGet() == 1) {
                try {
                    Thread.sleep(5000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("interrupted", e);
                }
            }
            return "ok";
        });

        assertEquals("ok", invoker.call(call));
        assertEquals(2, call.attempts());
    }
}
