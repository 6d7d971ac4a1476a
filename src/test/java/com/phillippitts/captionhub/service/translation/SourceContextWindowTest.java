package com.phillippitts.captionhub.service.translation;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SourceContextWindowTest {

    @Test
    void snapshotExcludesCurrentTextAndKeepsNewestEntries() {
        SourceContextWindow window = new SourceContextWindow(2);

        assertThat(window.snapshotAndAppend("one")).isEmpty();
        assertThat(window.snapshotAndAppend("two")).containsExactly("one");
        assertThat(window.snapshotAndAppend("three")).containsExactly("one", "two");
        assertThat(window.snapshotAndAppend("four")).containsExactly("two", "three");
        assertThat(window.size()).isEqualTo(2);
    }

    @Test
    void zeroCapacityDisablesContext() {
        SourceContextWindow window = new SourceContextWindow(0);
        window.snapshotAndAppend("one");

        assertThat(window.snapshotAndAppend("two")).isEmpty();
    }
}
