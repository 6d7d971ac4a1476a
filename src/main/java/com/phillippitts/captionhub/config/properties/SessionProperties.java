package com.phillippitts.captionhub.config.properties;

import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for session lifecycle handling.
 */
@Validated
@ConfigurationProperties(prefix = "session")
public class SessionProperties {

    /** Time in-flight translations get to finish once a session ends. */
    @PositiveOrZero
    private long endGracePeriodMs = 5000;

    /** Number of ended sessions remembered for state queries. */
    @Positive
    private int endedRetention = 256;

    public long getEndGracePeriodMs() {
        return endGracePeriodMs;
    }

    public void setEndGracePeriodMs(long endGracePeriodMs) {
        this.endGracePeriodMs = endGracePeriodMs;
    }

    public int getEndedRetention() {
        return endedRetention;
    }

    public void setEndedRetention(int endedRetention) {
        this.endedRetention = endedRetention;
    }
}
