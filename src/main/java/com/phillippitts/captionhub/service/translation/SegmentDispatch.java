package com.phillippitts.captionhub.service.translation;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on the in-flight translations of one segment.
 *
 * <p>{@link #completion()} completes once every language has handed its terminal outcome to
 * the sink. {@link #cancel()} stops outstanding attempts; each cancelled language hands a
 * {@code cancelled} failure marker to the sink before {@code cancel()} returns.
 */
public final class SegmentDispatch {

    private final long sequence;
    private final List<CompletableFuture<String>> attempts;
    private final CompletableFuture<Void> completion;

    /**
     * @param sequence segment sequence number
     * @param attempts one retrying translation future per language
     * @param outcomes one future per language, completed after the sink was invoked
     */
    SegmentDispatch(long sequence, List<CompletableFuture<String>> attempts, List<CompletableFuture<Void>> outcomes) {
        this.sequence = sequence;
        this.attempts = List.copyOf(attempts);
        this.completion = CompletableFuture.allOf(outcomes.toArray(CompletableFuture[]::new))
                .handle((ignored, error) -> null);
    }

    public long sequence() {
        return sequence;
    }

    public CompletableFuture<Void> completion() {
        return completion;
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Cancels every language that has not produced an outcome yet.
     *
     * @return number of languages cancelled
     */
    public int cancel() {
        int cancelled = 0;
        for (CompletableFuture<String> f : attempts) {
            if (f.cancel(true)) {
                cancelled++;
            }
        }
        return cancelled;
    }
}
