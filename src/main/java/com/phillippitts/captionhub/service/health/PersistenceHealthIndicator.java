package com.phillippitts.captionhub.service.health;

import com.phillippitts.captionhub.service.persistence.DurableLogger;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the durable logger.
 *
 * <ul>
 *   <li>UP: writer running and the last batch was stored</li>
 *   <li>DEGRADED: the last batch failed, records were dropped on overflow, or storage
 *       refused records permanently</li>
 *   <li>DOWN: writer thread not running</li>
 * </ul>
 *
 * <p>Persistence never gates caption delivery, so DEGRADED is informational.
 */
@Component
public class PersistenceHealthIndicator implements HealthIndicator {

    private final DurableLogger logger;

    public PersistenceHealthIndicator(DurableLogger logger) {
        this.logger = logger;
    }

    @Override
    public Health health() {
        DurableLogger.Stats stats = logger.stats();
        Health.Builder builder;
        if (!stats.running()) {
            builder = Health.down().withDetail("status", "Writer stopped");
        } else if (stats.lastBatchFailed()) {
            builder = Health.status("DEGRADED").withDetail("status", "Storage writes failing");
        } else if (stats.dropped() > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Records dropped on overflow");
        } else if (stats.rejected() > 0) {
            builder = Health.status("DEGRADED").withDetail("status", "Records refused by storage");
        } else {
            builder = Health.up().withDetail("status", "Writing");
        }
        builder.withDetail("queued", stats.queued())
                .withDetail("capacity", stats.capacity())
                .withDetail("dropped", stats.dropped())
                .withDetail("writeFailures", stats.writeFailures())
                .withDetail("persisted", stats.persisted())
                .withDetail("rejected", stats.rejected());
        if (stats.lastFailureAt() != null) {
            builder.withDetail("lastFailureAt", stats.lastFailureAt().toString());
        }
        return builder.build();
    }
}
