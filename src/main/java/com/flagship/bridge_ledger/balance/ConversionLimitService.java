package com.flagship.bridge_ledger.balance;

import com.flagship.bridge_ledger.error.ValidationException;
import com.flagship.bridge_ledger.ledger.ChartOfAccounts;
import com.flagship.bridge_ledger.ledger.LedgerType;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Per-customer conversion limits over rolling windows.
 *
 * Windows are configured as {@code hours:sats} pairs, e.g.
 * {@code 4:400000,72:800000,168:1200000}. A conversion is allowed only if
 * it fits inside every window.
 */
@Service
@Slf4j
public class ConversionLimitService {

    static final Set<LedgerType> CONVERSION_TYPES =
        EnumSet.of(LedgerType.CONV_HIVE_TO_KEEPSATS, LedgerType.CONV_KEEPSATS_TO_HIVE);

    private final BalanceAggregator balanceAggregator;
    private final ChartOfAccounts chart;
    private final List<RateLimit> limits;

    public ConversionLimitService(BalanceAggregator balanceAggregator,
                                  ChartOfAccounts chart,
                                  @org.springframework.beans.factory.annotation.Value(
                                      "${conversion.rate-limits:4:400000,72:800000,168:1200000}") String rateLimits) {
        this.balanceAggregator = balanceAggregator;
        this.chart = chart;
        this.limits = parse(rateLimits);
    }

    public List<RateLimit> getLimits() {
        return limits;
    }

    /**
     * Checks whether converting another {@code extraSats} keeps the customer inside every window.
     *
     * Conversions already posted for {@code sourceGroupId} are not counted, so
     * an event that is processed again after a partial post is checked against
     * the same usage as on its first run.
     */
    public LimitCheckResult check(String custId, String sourceGroupId, long extraSats, Instant asOf) {
        List<LimitCheck> checks = new ArrayList<>();
        for (RateLimit limit : limits) {
            long usedMsats = balanceAggregator.conversionTotalMsats(custId, chart.customerLiability(custId),
                CONVERSION_TYPES, asOf, Duration.ofHours(limit.getHours()), sourceGroupId);
            long usedSats = usedMsats / 1000;
            boolean ok = usedSats + extraSats <= limit.getSats();
            checks.add(new LimitCheck(limit.getHours(), limit.getSats(), usedSats, ok));
        }
        LimitCheckResult result = new LimitCheckResult(custId, extraSats, Collections.unmodifiableList(checks));
        if (!result.isAllowed()) {
            log.warn("Conversion limit reached for {}: {}", custId, result);
        }
        return result;
    }

    static List<RateLimit> parse(String config) {
        if (config == null || config.isBlank()) {
            return List.of();
        }
        List<RateLimit> parsed = new ArrayList<>();
        for (String part : config.split(",")) {
            String[] fields = part.trim().split(":");
            if (fields.length != 2) {
                throw new ValidationException("Rate limit must be hours:sats, got '" + part + "'");
            }
            try {
                parsed.add(new RateLimit(Integer.parseInt(fields[0].trim()), Long.parseLong(fields[1].trim())));
            } catch (NumberFormatException e) {
                throw new ValidationException("Rate limit must be hours:sats, got '" + part + "'", e);
            }
        }
        return Collections.unmodifiableList(parsed);
    }

    @Value
    public static class RateLimit {
        int hours;
        long sats;
    }

    @Value
    public static class LimitCheck {
        int hours;
        long limitSats;
        long usedSats;
        boolean ok;
    }

    @Value
    public static class LimitCheckResult {
        String custId;
        long extraSats;
        List<LimitCheck> checks;

        public boolean isAllowed() {
            return checks.stream().allMatch(LimitCheck::isOk);
        }

        @Override
        public String toString() {
            return checks.stream()
                .map(c -> String.format("%dh: %d + %d of %d sats%s", c.getHours(), c.getUsedSats(),
                    extraSats, c.getLimitSats(), c.isOk() ? "" : " EXCEEDED"))
                .collect(Collectors.joining("; "));
        }
    }
}
