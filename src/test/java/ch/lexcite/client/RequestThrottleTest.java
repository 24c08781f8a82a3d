package ch.lexcite.client;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class RequestThrottleTest {

    @Test
    void intervalFollowsRequestsPerMinute() {
        assertEquals(6000, new RequestThrottle("federal", 10).minIntervalMillis());
        assertEquals(1000, new RequestThrottle("commentary", 60).minIntervalMillis());
    }

    @Test
    void rejectsNonPositiveBudget() {
        assertThrows(IllegalArgumentException.class, () -> new RequestThrottle("federal", 0));
        assertThrows(IllegalArgumentException.class, () -> new RequestThrottle("federal", -1));
    }

    @Test
    void spacesConsecutiveRequests() {
        RequestThrottle throttle = new RequestThrottle("test", 600);
        long start = System.nanoTime();

        for (int i = 0; i < 3; i++) {
            throttle.execute(() -> "ok");
        }

        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        assertTrue(elapsedMs >= 200, "three requests at 100 ms spacing took " + elapsedMs + " ms");
    }

    @Test
    void runsConcurrentCallersOneAtATime() {
        RequestThrottle throttle = new RequestThrottle("test", 60_000);
        AtomicInteger inFlight = new AtomicInteger();
        AtomicInteger maxInFlight = new AtomicInteger();

        List<CompletableFuture<Integer>> calls = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            int n = i;
            calls.add(CompletableFuture.supplyAsync(() -> throttle.execute(() -> {
                maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                inFlight.decrementAndGet();
                return n;
            })));
        }
        CompletableFuture.allOf(calls.toArray(new CompletableFuture[0])).join();

        assertEquals(1, maxInFlight.get());
    }

    @Test
    void propagatesRequestFailure() {
        RequestThrottle throttle = new RequestThrottle("test", 60_000);

        assertThrows(IllegalStateException.class, () -> throttle.execute(() -> {
            throw new IllegalStateException("boom");
        }));
        assertEquals("ok", throttle.execute(() -> "ok"));
    }
}
