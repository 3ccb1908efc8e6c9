package com.flagship.bridge_ledger.observability;

import com.flagship.bridge_ledger.ledger.LedgerStore;
import com.flagship.bridge_ledger.ledger.LedgerTotals;
import com.flagship.bridge_ledger.pipeline.ProcessingOutcome;
import com.flagship.bridge_ledger.pipeline.tracking.TrackedEventRepository;
import com.flagship.bridge_ledger.sanity.SanityCheckResult;
import com.flagship.bridge_ledger.sanity.SanityChecker;
import com.flagship.bridge_ledger.sanity.SanityReport;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Custom health indicators for the bridge ledger.
 */
public class HealthIndicators {

    /**
     * Reports the latest ledger sanity pass. Unknown until the first event has been processed.
     */
    @Component("ledgerSanity")
    public static class LedgerSanityHealthIndicator implements HealthIndicator {

        private final SanityChecker sanityChecker;

        public LedgerSanityHealthIndicator(SanityChecker sanityChecker) {
            this.sanityChecker = sanityChecker;
        }

        @Override
        public Health health() {
            Optional<SanityReport> latest = sanityChecker.latestReport();
            if (latest.isEmpty()) {
                return Health.unknown()
                        .withDetail("note", "No sanity pass has run yet")
                        .build();
            }
            SanityReport report = latest.get();
            Health.Builder builder = report.isValid() ? Health.up() : Health.down();
            builder.withDetail("checkedAt", report.getCheckedAt().toString());
            for (SanityCheckResult result : report.getResults()) {
                builder.withDetail(result.getName(), result.getDetails());
            }
            return builder.build();
        }
    }

    /**
     * Ledger and tracked-event tables are reachable; reports entry counts and terminal failures.
     */
    @Component("ledgerDatabase")
    public static class LedgerDatabaseHealthIndicator implements HealthIndicator {

        private final LedgerStore ledgerStore;
        private final TrackedEventRepository trackedEventRepository;

        public LedgerDatabaseHealthIndicator(LedgerStore ledgerStore,
                                             TrackedEventRepository trackedEventRepository) {
            this.ledgerStore = ledgerStore;
            this.trackedEventRepository = trackedEventRepository;
        }

        @Override
        public Health health() {
            try {
                LedgerTotals totals = ledgerStore.totals();
                long terminalFailures = trackedEventRepository.countByOutcome(ProcessingOutcome.FAILED_TERMINAL);
                return Health.up()
                        .withDetail("ledgerEntries", totals.getEntryCount())
                        .withDetail("trackedEvents", trackedEventRepository.count())
                        .withDetail("terminalFailures", terminalFailures)
                        .build();

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }

    /**
     * Health indicator for Redis connectivity. Locks cannot be taken without it.
     */
    @Component("redisHealth")
    public static class RedisHealthIndicator implements HealthIndicator {

        private final StringRedisTemplate redisTemplate;

        public RedisHealthIndicator(StringRedisTemplate redisTemplate) {
            this.redisTemplate = redisTemplate;
        }

        @Override
        public Health health() {
            try {
                var connectionFactory = redisTemplate.getConnectionFactory();
                if (connectionFactory == null) {
                    return Health.down()
                            .withDetail("error", "No connection factory configured")
                            .build();
                }
                try (var connection = connectionFactory.getConnection()) {
                    String result = connection.ping();
                    return "PONG".equals(result)
                            ? Health.up().withDetail("response", result).build()
                            : Health.down().withDetail("response", result != null ? result : "null").build();
                }

            } catch (Exception e) {
                return Health.down()
                        .withDetail("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName())
                        .build();
            }
        }
    }
}
