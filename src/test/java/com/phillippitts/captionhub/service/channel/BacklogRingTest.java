package com.phillippitts.captionhub.service.channel;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BacklogRingTest {

    @Test
    void keepsMostRecentEntriesOldestFirst() {
        BacklogRing<Integer> ring = new BacklogRing<>(3);
        for (int i = 1; i <= 7; i++) {
            ring.add(i);
        }

        assertThat(ring.snapshot()).containsExactly(5, 6, 7);
        assertThat(ring.size()).isEqualTo(3);
    }

    @Test
    void partiallyFilledRingReturnsWhatWasAdded() {
        BacklogRing<String> ring = new BacklogRing<>(5);
        ring.add("a");
        ring.add("b");

        assertThat(ring.snapshot()).containsExactly("a", "b");
    }

    @Test
    void zeroCapacityKeepsNothing() {
        BacklogRing<String> ring = new BacklogRing<>(0);
        ring.add("a");

        assertThat(ring.snapshot()).isEmpty();
        assertThat(ring.capacity()).isZero();
    }

    @Test
    void clearEmptiesRing() {
        BacklogRing<Integer> ring = new BacklogRing<>(2);
        ring.add(1);
        ring.add(2);
        ring.clear();
        ring.add(3);

        assertThat(ring.snapshot()).containsExactly(3);
    }

    @Test
    void snapshotIsDetachedFromLaterAdds() {
        BacklogRing<Integer> ring = new BacklogRing<>(2);
        ring.add(1);
        List<Integer> before = ring.snapshot();

        ring.add(2);
        ring.add(3);

        assertThat(before).containsExactly(1);
        assertThat(ring.snapshot()).containsExactly(2, 3);
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThatThrownBy(() -> new BacklogRing<>(-1)).isInstanceOf(IllegalArgumentException.class);
    }
}
