package ch.lexcite.client;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import org.jetbrains.annotations.Nullable;

/**
 * One logical request to a source, shared by all of its retry attempts.
 */
public final class SourceCall<T> {

    private final String service;
    private final String operation;
    private final RequestThrottle throttle;
    private final Supplier<T> request;
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile Throwable lastFailure;

    public SourceCall(String service, String operation, RequestThrottle throttle, Supplier<T> request) {
        this.service = Objects.requireNonNull(service, "service must not be null");
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.throttle = Objects.requireNonNull(throttle, "throttle must not be null");
        this.request = Objects.requireNonNull(request, "request must not be null");
    }

    public String service() {
        return service;
    }

    public String operation() {
        return operation;
    }

    /**
     * @return {@code service.operation}, used as the retry log operation name
     */
    public String operationName() {
        return service + "." + operation;
    }

    RequestThrottle throttle() {
        return throttle;
    }

    Supplier<T> request() {
        return request;
    }

    int startAttempt() {
        return attempts.incrementAndGet();
    }

    void recordFailure(Throwable failure) {
        this.lastFailure = failure;
    }

    public int attempts() {
        return attempts.get();
    }

    @Nullable
    public Throwable lastFailure() {
        return lastFailure;
    }
}
