package com.phillippitts.captionhub.service.channel;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Restores per-channel sequence order for translations that complete out of order.
 *
 * <p>State: {@code nextExpected} (starts at 1) and the translations held because an earlier
 * slot is still missing. A translation for {@code nextExpected} is released immediately
 * together with every now-contiguous buffered entry; anything later is held.
 *
 * <p>Missing slots are resolved by skipping, never by waiting forever:
 * <ul>
 *   <li>{@link #skipStalled(String)} - called by the owning channel when the stall timer
 *       fires; skips every missing slot below the lowest buffered sequence</li>
 *   <li>overflow - when more than {@code maxPending} entries are held, the same gap skip
 *       runs until the buffer is back within bounds</li>
 *   <li>{@link #flush(String)} - teardown; skips every gap until nothing is held</li>
 * </ul>
 * A gap wider than {@code maxPending} collapses into one marker on its last slot whose
 * {@link Translation#skippedFrom()} names the first missing slot, so a sequence jump from the
 * source cannot produce an unbounded burst of markers and subscribers still see the whole range.
 *
 * <p><b>Thread Safety:</b> not thread-safe. The owning channel serializes all calls under
 * its lock.
 */
public final class ReorderBuffer {

    /** Skip reason used when the stall timer fires. */
    public static final String REASON_TIMEOUT = "timeout";
    /** Skip reason used when the buffer exceeds its capacity. */
    public static final String REASON_OVERFLOW = "overflow";
    /** Skip reason used when the channel is torn down. */
    public static final String REASON_FLUSH = "flush";

    /**
     * Outcome of offering one translation.
     *
     * @param released translations to pass downstream, in strictly increasing sequence order
     * @param late     {@code true} when the offered translation was dropped because its slot
     *                 had already been released, skipped or buffered
     */
    public record Release(List<Translation> released, boolean late) {

        static final Release LATE = new Release(List.of(), true);

        public boolean isEmpty() {
            return released.isEmpty();
        }
    }

    private final ChannelKey channel;
    private final int maxPending;
    private final NavigableMap<Long, Translation> pending = new TreeMap<>();
    private long nextExpected = 1;

    public ReorderBuffer(ChannelKey channel, int maxPending) {
        this.channel = Objects.requireNonNull(channel, "channel");
        if (maxPending < 1) {
            throw new IllegalArgumentException("maxPending must be >= 1, got: " + maxPending);
        }
        this.maxPending = maxPending;
    }

    /**
     * Accepts one completed translation.
     *
     * @param translation terminal outcome for a slot of this channel
     * @return translations now releasable, or {@link Release#late()} for a stale slot
     */
    public Release offer(Translation translation) {
        long sequence = translation.sequence();
        if (sequence < nextExpected || pending.containsKey(sequence)) {
            return Release.LATE;
        }
        List<Translation> released = new ArrayList<>();
        if (sequence == nextExpected) {
            released.add(translation);
            nextExpected++;
            drainContiguous(released);
        } else {
            pending.put(sequence, translation);
            while (pending.size() > maxPending) {
                skipGap(REASON_OVERFLOW, released);
            }
        }
        return new Release(released, false);
    }

    /**
     * Skips the missing slots that block the lowest buffered translation.
     *
     * @param reason marker reason
     * @return markers and the translations they unblocked; empty when nothing is stalled
     */
    public List<Translation> skipStalled(String reason) {
        List<Translation> released = new ArrayList<>();
        if (!pending.isEmpty()) {
            skipGap(reason, released);
        }
        return released;
    }

    /**
     * Releases everything held, skipping every gap on the way.
     */
    public List<Translation> flush(String reason) {
        List<Translation> released = new ArrayList<>();
        while (!pending.isEmpty()) {
            skipGap(reason, released);
        }
        return released;
    }

    /**
     * @return {@code true} when translations are held behind a missing slot
     */
    public boolean isStalled() {
        return !pending.isEmpty();
    }

    public long nextExpected() {
        return nextExpected;
    }

    public int pendingCount() {
        return pending.size();
    }

    private void skipGap(String reason, List<Translation> released) {
        long lowestHeld = pending.firstKey();
        long gap = lowestHeld - nextExpected;
        if (gap > maxPending) {
            released.add(Translation.skippedRange(channel, nextExpected, lowestHeld - 1, reason));
        } else {
            for (long slot = nextExpected; slot < lowestHeld; slot++) {
                released.add(Translation.skipped(channel, slot, reason));
            }
        }
        nextExpected = lowestHeld;
        drainContiguous(released);
    }

    private void drainContiguous(List<Translation> released) {
        Map.Entry<Long, Translation> head = pending.firstEntry();
        while (head != null && head.getKey() == nextExpected) {
            released.add(pending.pollFirstEntry().getValue());
            nextExpected++;
            head = pending.firstEntry();
        }
    }
}
