package com.phoenix.worker.runtime;

import com.phoenix.worker.domain.FailureKind;
import com.phoenix.worker.domain.FailureReason;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

/**
 * Runs one activity with a timeout, bounded attempts with exponential backoff, and idempotency
 * keyed by (instance id, activity name, input hash).
 * <p>
 * Only transient errors are retried. A {@link CostCeilingReachedException} raised by the reservation
 * or the activity body is passed through untouched so the caller can stop spending. A full activity
 * pool fails the attempt as transient; the body never runs on the caller's thread.
 */
public class ActivityInvoker {

    private static final Logger LOGGER = LoggerFactory.getLogger(ActivityInvoker.class);

    private final ActivityPolicies policies;
    private final IdempotencyStore idempotencyStore;
    private final Executor activityExecutor;

    public ActivityInvoker(ActivityPolicies policies, IdempotencyStore idempotencyStore, Executor activityExecutor) {
        this.policies = policies;
        this.idempotencyStore = idempotencyStore;
        this.activityExecutor = new MdcAwareExecutor(activityExecutor);
    }

    public <T> T invoke(ActivityScope scope, String activity, Object input, Supplier<T> body) {
        return invoke(scope, activity, input, () -> { }, body);
    }

    /**
     * Like {@link #invoke(ActivityScope, String, Object, Supplier)}, but first runs {@code reserve}
     * once per idempotency key, before the first attempt. Retries of the same input do not reserve again.
     * A reservation that throws ends the invocation without calling the activity.
     */
    public <T> T invoke(ActivityScope scope, String activity, Object input, Runnable reserve, Supplier<T> body) {
        String key = idempotencyStore.key(scope.instanceId(), activity, input);
        Optional<Object> remembered = idempotencyStore.find(key);
        if (remembered.isPresent()) {
            LOGGER.debug("Activity {} already completed for instance {}, reusing result", activity, scope.instanceId());
            @SuppressWarnings("unchecked")
            T reused = (T) IdempotencyStore.unwrap(remembered.get());
            return reused;
        }
        reserveOnce(key, reserve);

        RetryPolicy policy = policies.policyFor(activity);
        RuntimeException lastError = null;
        for (int attempt = 1; attempt <= policy.maxAttempts(); attempt++) {
            scope.recordAttempt(activity);
            try {
                T result = runWithTimeout(activity, body, policy.timeout());
                idempotencyStore.remember(key, result);
                return result;
            } catch (CostCeilingReachedException | ActivityFailedException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                lastError = ex;
                if (!isRetryable(ex)) {
                    throw new ActivityFailedException(
                        new FailureReason(FailureKind.VALIDATION, activity, describe(ex)), ex);
                }
                if (attempt < policy.maxAttempts()) {
                    Duration backoff = policy.backoffAfter(attempt);
                    LOGGER.warn("Activity {} attempt {}/{} failed for instance {}: {}; retrying in {} ms",
                        activity, attempt, policy.maxAttempts(), scope.instanceId(), describe(ex), backoff.toMillis());
                    pause(activity, backoff);
                }
            }
        }
        throw new ActivityFailedException(
            new FailureReason(FailureKind.TRANSIENT, activity,
                "gave up after " + policy.maxAttempts() + " attempts: " + describe(lastError)),
            lastError);
    }

    private void reserveOnce(String key, Runnable reserve) {
        String reservation = "reserved:" + key;
        if (!idempotencyStore.markIfAbsent(reservation)) {
            return;
        }
        try {
            reserve.run();
        } catch (RuntimeException ex) {
            idempotencyStore.forget(reservation);
            throw ex;
        }
    }

    private <T> T runWithTimeout(String activity, Supplier<T> body, Duration timeout) {
        CompletableFuture<T> future;
        try {
            future = CompletableFuture.supplyAsync(body, activityExecutor);
        } catch (RejectedExecutionException ex) {
            throw new TransientActivityException("activity pool saturated", ex);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new TransientActivityException("timed out after " + timeout.toMillis() + " ms", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof IOException io) {
                throw new UncheckedIOException(io);
            }
            throw new TransientActivityException(String.valueOf(cause), cause);
        } catch (InterruptedException ex) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw interrupted(activity, ex);
        }
    }

    private void pause(String activity, Duration backoff) {
        if (backoff.isZero()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw interrupted(activity, ex);
        }
    }

    private ActivityFailedException interrupted(String activity, InterruptedException ex) {
        return new ActivityFailedException(new FailureReason(FailureKind.TRANSIENT, activity, "interrupted"), ex);
    }

    static boolean isRetryable(Throwable ex) {
        if (ex instanceof ActivityException activityException) {
            return activityException.isRetryable();
        }
        if (ex instanceof HttpStatusCodeException httpError) {
            return httpError.getStatusCode().is5xxServerError() || httpError.getStatusCode().value() == 429;
        }
        if (ex instanceof ResourceAccessException || ex instanceof UncheckedIOException) {
            return true;
        }
        return !(ex instanceof IllegalArgumentException);
    }

    private static String describe(Throwable ex) {
        if (ex == null) {
            return "unknown";
        }
        return ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
    }
}
