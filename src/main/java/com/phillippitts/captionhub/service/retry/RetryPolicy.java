package com.phillippitts.captionhub.service.retry;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.function.DoubleSupplier;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Bounded retry with exponential backoff and jitter for calls to external collaborators.
 *
 * <p>One policy object describes the whole retry behaviour of a call site:
 * <ul>
 *   <li>{@code maxAttempts}: total attempts including the first one</li>
 *   <li>{@code baseDelay}/{@code maxDelay}: delay before retry {@code n} is
 *       {@code min(maxDelay, baseDelay * 2^(n-1))}</li>
 *   <li>{@code jitterFactor}: that fraction of the delay is randomized downwards</li>
 *   <li>{@code retryable}: predicate deciding whether a failure is transient</li>
 * </ul>
 *
 * <p>The translation fan-out uses {@link #executeAsync} so backoff never parks a pool
 * thread; the durable logger's single writer thread uses the blocking {@link #execute}.
 *
 * <p>Instances are immutable and thread-safe.
 */
public final class RetryPolicy {

    /**
     * Callback invoked before each retry.
     */
    @FunctionalInterface
    public interface RetryListener {
        /**
         * @param attempt number of the attempt that just failed (1-based)
         * @param failure the failure being retried
         * @param delayMs backoff before the next attempt
         */
        void onRetry(int attempt, Throwable failure, long delayMs);

        RetryListener NONE = (attempt, failure, delayMs) -> { };
    }

    /**
     * A blocking call that may throw.
     */
    @FunctionalInterface
    public interface Call<T> {
        T call() throws Exception;
    }

    private final int maxAttempts;
    private final Duration baseDelay;
    private final Duration maxDelay;
    private final double jitterFactor;
    private final Predicate<Throwable> retryable;
    private final DoubleSupplier random;

    private RetryPolicy(Builder b) {
        this.maxAttempts = b.maxAttempts;
        this.baseDelay = b.baseDelay;
        this.maxDelay = b.maxDelay;
        this.jitterFactor = b.jitterFactor;
        this.retryable = b.retryable;
        this.random = b.random;
    }

    public static Builder builder() {
        return new Builder();
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    /**
     * Decides whether another attempt should follow a failed one.
     *
     * @param attempt number of the attempt that failed (1-based)
     * @param failure the failure, unwrapped from completion wrappers
     * @return true when the failure is retryable and attempts remain
     */
    public boolean shouldRetry(int attempt, Throwable failure) {
        return attempt < maxAttempts && !(failure instanceof CancellationException) && retryable.test(failure);
    }

    /**
     * Backoff before the attempt following {@code attempt}.
     *
     * @param attempt number of the attempt that failed (1-based)
     * @return delay in milliseconds, within {@code [delay * (1 - jitter), delay]}
     */
    public long backoffMillis(int attempt) {
        long base = baseDelay.toMillis();
        long cap = maxDelay.toMillis();
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long exponential = base << shift;
        long delay = (exponential <= 0 || exponential > cap) ? cap : exponential;
        double jitter = delay * jitterFactor * random.getAsDouble();
        return Math.max(0L, Math.round(delay - jitter));
    }

    /**
     * Runs {@code call}, sleeping between attempts on the calling thread.
     *
     * @return the first successful result
     * @throws Exception the last failure once retries are exhausted or the failure is not retryable
     */
    public <T> T execute(Call<T> call, RetryListener listener) throws Exception {
        Objects.requireNonNull(call, "call");
        RetryListener l = listener == null ? RetryListener.NONE : listener;
        int attempt = 1;
        while (true) {
            try {
                return call.call();
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw ie;
            } catch (Exception ex) {
                if (!shouldRetry(attempt, ex)) {
                    throw ex;
                }
                long delay = backoffMillis(attempt);
                l.onRetry(attempt, ex, delay);
                Thread.sleep(delay);
                attempt++;
            }
        }
    }

    /**
     * Runs asynchronous attempts produced by {@code attemptFactory}, scheduling retries with
     * a delayed executor instead of sleeping.
     *
     * <p>Cancelling or completing the returned future stops further attempts.
     *
     * @param attemptFactory creates one attempt per invocation
     * @param executor executor on which retries are launched; never the caller's thread
     * @param listener retry callback (nullable)
     * @return future completed with the first success or the final failure (unwrapped)
     */
    public <T> CompletableFuture<T> executeAsync(Supplier<CompletableFuture<T>> attemptFactory,
                                                 Executor executor,
                                                 RetryListener listener) {
        Objects.requireNonNull(attemptFactory, "attemptFactory");
        Objects.requireNonNull(executor, "executor");
        CompletableFuture<T> result = new CompletableFuture<>();
        runAttempt(1, attemptFactory, executor, listener == null ? RetryListener.NONE : listener, result);
        return result;
    }

    private <T> void runAttempt(int attempt,
                                Supplier<CompletableFuture<T>> attemptFactory,
                                Executor executor,
                                RetryListener listener,
                                CompletableFuture<T> result) {
        if (result.isDone()) {
            return;
        }
        CompletableFuture<T> current;
        try {
            current = attemptFactory.get();
        } catch (RuntimeException ex) {
            current = CompletableFuture.failedFuture(ex);
        }
        current.whenComplete((value, error) -> {
            if (error == null) {
                result.complete(value);
                return;
            }
            Throwable cause = unwrap(error);
            if (result.isDone() || !shouldRetry(attempt, cause)) {
                result.completeExceptionally(cause);
                return;
            }
            long delay = backoffMillis(attempt);
            listener.onRetry(attempt, cause, delay);
            Executor delayed = CompletableFuture.delayedExecutor(delay, TimeUnit.MILLISECONDS,
                    rejectingInto(executor, result));
            delayed.execute(() -> runAttempt(attempt + 1, attemptFactory, executor, listener, result));
        });
    }

    /**
     * Hands retries to {@code executor}. A rejected launch fails {@code result} instead of
     * running the retry on the JDK's shared delay thread.
     */
    private static Executor rejectingInto(Executor executor, CompletableFuture<?> result) {
        return task -> {
            try {
                executor.execute(task);
            } catch (RejectedExecutionException ex) {
                result.completeExceptionally(ex);
            }
        };
    }

    /**
     * Strips {@link CompletionException}/{@link ExecutionException} wrappers.
     */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Builder for {@link RetryPolicy}.
     */
    public static final class Builder {
        private int maxAttempts = 3;
        private Duration baseDelay = Duration.ofMillis(200);
        private Duration maxDelay = Duration.ofSeconds(5);
        private double jitterFactor = 0.5;
        private Predicate<Throwable> retryable = t -> true;
        private DoubleSupplier random = () -> ThreadLocalRandom.current().nextDouble();

        private Builder() {
        }

        /**
         * @param retries retries after the first attempt (0 = single attempt)
         */
        public Builder maxRetries(int retries) {
            if (retries < 0) {
                throw new IllegalArgumentException("retries must be >= 0, got: " + retries);
            }
            this.maxAttempts = retries + 1;
            return this;
        }

        public Builder baseDelay(Duration baseDelay) {
            this.baseDelay = Objects.requireNonNull(baseDelay, "baseDelay");
            return this;
        }

        public Builder maxDelay(Duration maxDelay) {
            this.maxDelay = Objects.requireNonNull(maxDelay, "maxDelay");
            return this;
        }

        public Builder jitterFactor(double jitterFactor) {
            if (jitterFactor < 0.0 || jitterFactor > 1.0) {
                throw new IllegalArgumentException("jitterFactor must be within [0, 1], got: " + jitterFactor);
            }
            this.jitterFactor = jitterFactor;
            return this;
        }

        public Builder retryOn(Predicate<Throwable> retryable) {
            this.retryable = Objects.requireNonNull(retryable, "retryable");
            return this;
        }

        /** Visible for tests: source of jitter in [0, 1). */
        public Builder random(DoubleSupplier random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        public RetryPolicy build() {
            if (baseDelay.isNegative() || maxDelay.isNegative()) {
                throw new IllegalArgumentException("delays must not be negative");
            }
            if (maxDelay.compareTo(baseDelay) < 0) {
                maxDelay = baseDelay;
            }
            return new RetryPolicy(this);
        }
    }
}
