package com.tradeguard.risk.model;

import lombok.Builder;

import java.time.Instant;

/**
 * One open position as tracked by the caller. The engine only ever returns modified copies.
 *
 * @param highWaterMark most favourable price seen since entry (highest for longs, lowest
 *                      for shorts); null until the first evaluation
 */
@Builder(toBuilder = true)
public record PositionState(
        String symbol,
        PositionSide side,
        double entryPrice,
        double quantity,
        Instant entryTime,
        Double highWaterMark
) {

    public PositionState withHighWaterMark(double mark) {
        return toBuilder().highWaterMark(mark).build();
    }

    public double notional(double price) {
        return Math.abs(quantity * price);
    }

    public double unrealizedPnl(double price) {
        return (price - entryPrice) * quantity * side.direction();
    }
}
