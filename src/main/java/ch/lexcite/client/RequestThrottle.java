package ch.lexcite.client;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rate limiter for one external source.
 *
 * <p>Requests run one at a time in arrival order, and each starts at least
 * {@code 60000 / requestsPerMinute} milliseconds after the previous one started.
 * Callers over budget wait in the queue instead of failing. Waits are
 * interruptible, so an overall timeout cancels a queued request.</p>
 */
public class RequestThrottle {

    private static final Logger logger = LoggerFactory.getLogger(RequestThrottle.class);

    private final String service;
    private final long minIntervalNanos;
    private final ReentrantLock lock = new ReentrantLock(true);

    // guarded by lock
    private long lastStartNanos;
    private boolean started;

    public RequestThrottle(String service, int requestsPerMinute) {
        if (requestsPerMinute <= 0) {
            throw new IllegalArgumentException("requestsPerMinute must be positive, got " + requestsPerMinute);
        }
        this.service = service;
        this.minIntervalNanos = TimeUnit.MILLISECONDS.toNanos(60_000L / requestsPerMinute);
    }

    public String service() {
        return service;
    }

    public long minIntervalMillis() {
        return TimeUnit.NANOSECONDS.toMillis(minIntervalNanos);
    }

    /**
     * @return number of callers waiting for their turn
     */
    public int queueLength() {
        return lock.getQueueLength();
    }

    /**
     * Runs a request once this source's budget allows it.
     *
     * @throws ExternalServiceException with kind TIMEOUT when the wait is interrupted
     */
    public <T> T execute(Supplier<T> request) {
        try {
            lock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw ExternalServiceException.timeout(service, "rate limiter queue", e);
        }
        try {
            awaitTurn();
            return request.get();
        } finally {
            lock.unlock();
        }
    }

    private void awaitTurn() {
        if (started) {
            long waitNanos = lastStartNanos + minIntervalNanos - System.nanoTime();
            if (waitNanos > 0) {
                logger.debug("Throttling {} request for {} ms", service, TimeUnit.NANOSECONDS.toMillis(waitNanos));
                try {
                    TimeUnit.NANOSECONDS.sleep(waitNanos);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw ExternalServiceException.timeout(service, "rate limiter wait", e);
                }
            }
        }
        lastStartNanos = System.nanoTime();
        started = true;
    }
}
