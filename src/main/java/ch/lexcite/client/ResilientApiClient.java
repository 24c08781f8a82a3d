package ch.lexcite.client;

import java.util.function.Supplier;

import ch.lexcite.utils.RetryEventLogger;
import jakarta.inject.Inject;

/**
 * Base class of the source clients.
 *
 * <p>Runs every request through the source's throttle and the shared retry
 * policy, and makes sure nothing but {@link ExternalServiceException} reaches
 * the caller.</p>
 */
public abstract class ResilientApiClient {

    @Inject
    protected ResilientInvoker invoker;

    @Inject
    protected RetryEventLogger retryEventLogger;

    /**
     * @return source name used in failures and logs
     */
    protected abstract String service();

    protected abstract RequestThrottle throttle();

    protected <T> T invoke(String operation, Supplier<T> request) {
        SourceCall<T> call = new SourceCall<>(service(), operation, throttle(), request);
        try {
            T result = invoker.call(call);
            retryEventLogger.logRetrySuccess(call.operationName(), call.attempts());
            return result;
        } catch (RuntimeException e) {
            ExternalServiceException failure = ExternalFailureClassifier.classify(e, service(), operation);
            if (failure.kind() != FailureKind.NOT_FOUND) {
                retryEventLogger.logRetryExhausted(call.operationName(), Math.max(1, call.attempts()), failure);
            }
            throw failure;
        }
    }

    /**
     * Like {@link #invoke}, but a NOT_FOUND failure or a null result becomes a not-found result.
     */
    protected <T> LookupResult<T> lookup(String operation, Supplier<T> request) {
        try {
            T record = invoke(operation, request);
            return record == null ? LookupResult.notFound() : LookupResult.found(record);
        } catch (ExternalServiceException e) {
            if (e.kind() == FailureKind.NOT_FOUND) {
                return LookupResult.notFound();
            }
            throw e;
        }
    }
}
