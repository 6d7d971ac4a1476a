package com.phillippitts.captionhub.service.translation;

import com.phillippitts.captionhub.config.properties.TranslationProperties;
import com.phillippitts.captionhub.domain.TranscriptSegment;
import com.phillippitts.captionhub.domain.Translation;
import com.phillippitts.captionhub.exception.TranslationException;
import com.phillippitts.captionhub.exception.TranslationException.FailureKind;
import com.phillippitts.captionhub.service.metrics.PipelineMetricsPublisher;
import com.phillippitts.captionhub.service.retry.RetryPolicy;
import com.phillippitts.captionhub.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatches one final segment to every target language of its session concurrently.
 *
 * <p>Per (segment, language) pair:
 * <ul>
 *   <li><b>Timeout:</b> each attempt is bounded by {@code translation.timeout-ms}, counted from
 *       submission to the pool</li>
 *   <li><b>Retry:</b> transient failures (timeout, rate limit, server, network, saturated pool)
 *       are retried up to {@code translation.max-retries} times with exponential backoff and jitter</li>
 *   <li><b>Non-transient failures</b> (invalid input, unsupported language) fail at once</li>
 *   <li><b>Outcome:</b> exactly one terminal {@link Translation} (translated or failure marker)
 *       is handed to the sink. A cancelled pair yields a {@code cancelled} failure marker on the
 *       cancelling thread.</li>
 * </ul>
 *
 * <p>Languages are independent: a slow or failing language never delays another one.
 * No ordering is guaranteed between languages of the same segment.
 *
 * <p><b>Thread Model:</b> attempts run on {@code translationExecutor} and never on the
 * dispatching thread, so {@link #dispatch} does not block. A full pool rejects the attempt
 * and it fails as {@code overloaded}. Backoff uses delayed scheduling, so no pool thread sleeps
 * between attempts. The sink is invoked on whichever thread completes the pair.
 */
@Service
public class TranslationFanOut {

    private static final Logger LOG = LogManager.getLogger(TranslationFanOut.class);

    private final TranslationClient client;
    private final Executor executor;
    private final RetryPolicy retryPolicy;
    private final long timeoutMs;
    private final PipelineMetricsPublisher metrics;

    @Autowired
    public TranslationFanOut(TranslationClient client,
                             @Qualifier("translationExecutor") Executor executor,
                             TranslationProperties properties,
                             PipelineMetricsPublisher metrics) {
        this(client, executor, policyFrom(properties), properties.getTimeoutMs(), metrics);
    }

    public TranslationFanOut(TranslationClient client,
                             Executor executor,
                             RetryPolicy retryPolicy,
                             long timeoutMs,
                             PipelineMetricsPublisher metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : 4000;
        this.metrics = metrics == null ? PipelineMetricsPublisher.NOOP : metrics;
        LOG.info("Translation fan-out ready: client={}, timeoutMs={}, maxAttempts={}",
                client.name(), this.timeoutMs, retryPolicy.maxAttempts());
    }

    /**
     * Builds the translation retry policy from configuration.
     */
    public static RetryPolicy policyFrom(TranslationProperties properties) {
        return RetryPolicy.builder()
                .maxRetries(properties.getMaxRetries())
                .baseDelay(Duration.ofMillis(properties.getBackoffBaseMs()))
                .maxDelay(Duration.ofMillis(properties.getBackoffMaxMs()))
                .jitterFactor(properties.getJitterFactor())
                .retryOn(TranslationFanOut::isTransient)
                .build();
    }

    /**
     * Issues one translation per target language for {@code segment}.
     *
     * @param segment         final segment to translate
     * @param sourceLanguage  session source language
     * @param targetLanguages session target languages
     * @param context         preceding source segments for the translator
     * @param sink            receives exactly one terminal translation per language
     * @return handle for awaiting or cancelling the in-flight work
     */
    public SegmentDispatch dispatch(TranscriptSegment segment,
                                    String sourceLanguage,
                                    List<String> targetLanguages,
                                    List<String> context,
                                    TranslationSink sink) {
        Objects.requireNonNull(segment, "segment");
        Objects.requireNonNull(sink, "sink");
        List<CompletableFuture<String>> attempts = new ArrayList<>(targetLanguages.size());
        List<CompletableFuture<Void>> outcomes = new ArrayList<>(targetLanguages.size());

        for (String language : targetLanguages) {
            TranslationRequest request = new TranslationRequest(segment.sessionId(), segment.sequence(),
                    segment.text(), sourceLanguage, language, context);
            long startNanos = System.nanoTime();

            CompletableFuture<String> attempt = retryPolicy.executeAsync(
                    () -> attemptOnce(request),
                    executor,
                    (n, failure, delayMs) -> {
                        LOG.debug("Retrying seq={} lang={} after attempt {} ({}), backoff={}ms",
                                segment.sequence(), language, n, failureKind(failure), delayMs);
                        metrics.translationRetried(language, failureKind(failure));
                    });

            CompletableFuture<Void> outcome = attempt.handle((text, error) -> {
                emit(sink, toTranslation(segment, language, text, error, startNanos));
                return null;
            });
            attempts.add(attempt);
            outcomes.add(outcome);
        }
        return new SegmentDispatch(segment.sequence(), attempts, outcomes);
    }

    private CompletableFuture<String> attemptOnce(TranslationRequest request) {
        CompletableFuture<String> attempt = new CompletableFuture<>();
        attempt.orTimeout(timeoutMs, TimeUnit.MILLISECONDS);
        try {
            executor.execute(() -> runAttempt(request, attempt));
        } catch (RejectedExecutionException e) {
            attempt.completeExceptionally(new TranslationException("Translation pool saturated",
                    FailureKind.OVERLOADED, request.targetLanguage(), e));
        }
        return attempt;
    }

    private void runAttempt(TranslationRequest request, CompletableFuture<String> attempt) {
        if (attempt.isDone()) {
            return;
        }
        ThreadContext.put("language", request.targetLanguage());
        try {
            attempt.complete(client.translate(request));
        } catch (RuntimeException e) {
            attempt.completeExceptionally(e);
        } finally {
            ThreadContext.remove("language");
        }
    }

    private Translation toTranslation(TranscriptSegment segment, String language, String text,
                                      Throwable error, long startNanos) {
        long elapsed = System.nanoTime() - startNanos;
        if (error == null) {
            metrics.translationSucceeded(language, elapsed);
            return Translation.translated(segment, language, text);
        }
        Throwable cause = RetryPolicy.unwrap(error);
        String kind = failureKind(cause);
        metrics.translationFailed(language, elapsed, kind);
        if (cause instanceof CancellationException) {
            LOG.info("Translation seq={} lang={} cancelled after {} ms; emitting failure marker",
                    segment.sequence(), language, TimeUtils.nanosToMillis(elapsed));
        } else if (isTransient(cause)) {
            LOG.warn("Translation seq={} lang={} failed after retries ({}, {} ms); emitting failure marker",
                    segment.sequence(), language, kind, TimeUtils.nanosToMillis(elapsed));
        } else {
            LOG.warn("Translation seq={} lang={} rejected ({}): {}",
                    segment.sequence(), language, kind, cause.getMessage());
        }
        return Translation.failed(segment, language, kind);
    }

    private static void emit(TranslationSink sink, Translation translation) {
        try {
            sink.onTranslation(translation);
        } catch (RuntimeException ex) {
            LOG.error("Translation sink failed for seq={} lang={}",
                    translation.sequence(), translation.language(), ex);
        }
    }

    static boolean isTransient(Throwable t) {
        if (t instanceof TimeoutException || t instanceof RejectedExecutionException) {
            return true;
        }
        return t instanceof TranslationException te && te.isTransient();
    }

    static String failureKind(Throwable t) {
        if (t instanceof TimeoutException) {
            return "timeout";
        }
        if (t instanceof CancellationException) {
            return "cancelled";
        }
        if (t instanceof RejectedExecutionException) {
            return "overloaded";
        }
        if (t instanceof TranslationException te) {
            return te.getKind().name().toLowerCase(Locale.ROOT);
        }
        return "unknown";
    }
}
