package com.flagship.bridge_ledger.conversion;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Units the bridge books value in.
 *
 * HIVE and HBD are the chain tokens, MSATS is the settlement unit every
 * conversion pivots through. USD is carried for reporting only.
 */
public enum Currency {
    HIVE(3, Kind.CHAIN_TOKEN, new BigDecimal("0.001")),
    HBD(3, Kind.CHAIN_TOKEN, new BigDecimal("0.001")),
    USD(6, Kind.REFERENCE, new BigDecimal("0.01")),
    SATS(0, Kind.SETTLEMENT, BigDecimal.ONE),
    MSATS(0, Kind.SETTLEMENT, BigDecimal.TEN);

    private enum Kind {
        CHAIN_TOKEN,
        SETTLEMENT,
        REFERENCE
    }

    private final int scale;
    private final Kind kind;
    private final BigDecimal tolerance;

    Currency(int scale, Kind kind, BigDecimal tolerance) {
        this.scale = scale;
        this.kind = kind;
        this.tolerance = tolerance;
    }

    public int getScale() {
        return scale;
    }

    public boolean isChainToken() {
        return kind == Kind.CHAIN_TOKEN;
    }

    public boolean isSettlement() {
        return kind == Kind.SETTLEMENT;
    }

    /**
     * Largest difference between two amounts in this unit that still counts as equal.
     */
    public BigDecimal getTolerance() {
        return tolerance;
    }

    /**
     * Smallest amount that can be moved on-chain; also the notification receipt amount.
     */
    public BigDecimal minimumAmount() {
        return BigDecimal.ONE.movePointLeft(scale);
    }

    public BigDecimal round(BigDecimal amount) {
        return amount.setScale(scale, RoundingMode.HALF_UP);
    }
}
