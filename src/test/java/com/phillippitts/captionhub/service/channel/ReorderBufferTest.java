package com.phillippitts.captionhub.service.channel;

import com.phillippitts.captionhub.domain.ChannelKey;
import com.phillippitts.captionhub.domain.Translation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReorderBufferTest {

    private static final ChannelKey KEY = new ChannelKey("s1", "fr");

    private static Translation t(long seq) {
        return Translation.translated("s1", seq, "fr", "text-" + seq);
    }

    private static List<Long> sequences(List<Translation> released) {
        return released.stream().map(Translation::sequence).toList();
    }

    @Test
    void releasesInOrderArrivalImmediately() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);

        assertThat(sequences(buffer.offer(t(1)).released())).containsExactly(1L);
        assertThat(sequences(buffer.offer(t(2)).released())).containsExactly(2L);
        assertThat(buffer.nextExpected()).isEqualTo(3);
        assertThat(buffer.isStalled()).isFalse();
    }

    @Test
    void holdsOutOfOrderArrivalsUntilGapFills() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(1));
        buffer.offer(t(2));

        ReorderBuffer.Release held = buffer.offer(t(4));
        assertThat(held.isEmpty()).isTrue();
        assertThat(held.late()).isFalse();
        assertThat(buffer.isStalled()).isTrue();
        assertThat(buffer.pendingCount()).isEqualTo(1);

        ReorderBuffer.Release filled = buffer.offer(t(3));
        assertThat(sequences(filled.released())).containsExactly(3L, 4L);
        assertThat(buffer.nextExpected()).isEqualTo(5);
        assertThat(buffer.isStalled()).isFalse();
    }

    @Test
    void dropsLateAndDuplicateArrivals() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(1));
        buffer.offer(t(3));

        assertThat(buffer.offer(t(1)).late()).isTrue();
        assertThat(buffer.offer(t(3)).late()).isTrue();
        assertThat(buffer.pendingCount()).isEqualTo(1);
    }

    @Test
    void stallSkipReleasesMarkerAndUnblockedEntries() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(1));
        buffer.offer(t(2));
        buffer.offer(t(4));
        buffer.offer(t(5));

        List<Translation> released = buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);

        assertThat(sequences(released)).containsExactly(3L, 4L, 5L);
        assertThat(released.get(0).outcome()).isEqualTo(Translation.Outcome.SKIPPED);
        assertThat(released.get(0).failureReason()).isEqualTo("timeout");
        assertThat(released.get(1).outcome()).isEqualTo(Translation.Outcome.TRANSLATED);
        assertThat(buffer.nextExpected()).isEqualTo(6);
    }

    @Test
    void lateArrivalAfterSkipIsDropped() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(2));
        buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);

        ReorderBuffer.Release release = buffer.offer(t(1));

        assertThat(release.late()).isTrue();
        assertThat(buffer.nextExpected()).isEqualTo(3);
    }

    @Test
    void skipStalledOnlySkipsFirstGap() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(2));
        buffer.offer(t(5));

        List<Translation> released = buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);

        assertThat(sequences(released)).containsExactly(1L, 2L);
        assertThat(buffer.isStalled()).isTrue();
        assertThat(buffer.nextExpected()).isEqualTo(3);
    }

    @Test
    void skipStalledIsNoOpWhenNothingHeld() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(1));

        assertThat(buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT)).isEmpty();
        assertThat(buffer.nextExpected()).isEqualTo(2);
    }

    @Test
    void overflowForcesSkipOfOldestGap() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 3);
        buffer.offer(t(2));
        buffer.offer(t(3));
        buffer.offer(t(4));

        ReorderBuffer.Release release = buffer.offer(t(5));

        assertThat(sequences(release.released())).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(release.released().get(0).failureReason()).isEqualTo(ReorderBuffer.REASON_OVERFLOW);
        assertThat(buffer.pendingCount()).isZero();
    }

    @Test
    void flushSkipsEveryGap() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(1));
        buffer.offer(t(3));
        buffer.offer(t(6));

        List<Translation> released = buffer.flush(ReorderBuffer.REASON_FLUSH);

        assertThat(sequences(released)).containsExactly(2L, 3L, 4L, 5L, 6L);
        assertThat(released).filteredOn(Translation::isMarker).extracting(Translation::sequence)
                .containsExactly(2L, 4L, 5L);
        assertThat(buffer.isStalled()).isFalse();
        assertThat(buffer.nextExpected()).isEqualTo(7);
    }

    @Test
    void wideGapCollapsesIntoSingleMarker() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 4);
        buffer.offer(t(1));
        buffer.offer(t(100));

        List<Translation> released = buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);

        assertThat(sequences(released)).containsExactly(99L, 100L);
        assertThat(released.get(0).isMarker()).isTrue();
        assertThat(released.get(0).skippedFrom()).isEqualTo(2);
        assertThat(released.get(0).slotsCovered()).isEqualTo(98);
        assertThat(buffer.nextExpected()).isEqualTo(101);
    }

    @Test
    void narrowGapMarkersCoverOneSlotEach() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 4);
        buffer.offer(t(3));

        List<Translation> released = buffer.skipStalled(ReorderBuffer.REASON_TIMEOUT);

        assertThat(released).filteredOn(Translation::isMarker)
                .allMatch(marker -> marker.skippedFrom() == marker.sequence() && marker.slotsCovered() == 1);
    }

    @Test
    void failureMarkersOccupyTheirSlot() {
        ReorderBuffer buffer = new ReorderBuffer(KEY, 8);
        buffer.offer(t(2));

        ReorderBuffer.Release release = buffer.offer(Translation.failed("s1", 1, "fr", "timeout"));

        assertThat(sequences(release.released())).containsExactly(1L, 2L);
        assertThat(release.released().get(0).outcome()).isEqualTo(Translation.Outcome.FAILED);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new ReorderBuffer(KEY, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
