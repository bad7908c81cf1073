package com.tradeguard.risk.model;

import lombok.Builder;

import java.time.Instant;

/**
 * Account state as read by the caller for a single decision.
 *
 * @param totalEquity       current account equity
 * @param cashBalance       free cash
 * @param timestamp         when the figures were read
 * @param startOfDayEquity  equity at the open of the current trading day, open positions
 *                          marked at that time
 * @param peakEquity        highest equity seen since the last drawdown reset
 * @param drawdownHalted    latched drawdown halt as returned by a previous evaluation
 */
@Builder(toBuilder = true)
public record AccountSnapshot(
        double totalEquity,
        double cashBalance,
        Instant timestamp,
        double startOfDayEquity,
        double peakEquity,
        boolean drawdownHalted
) {

    public static AccountSnapshot of(double totalEquity, double cashBalance, Instant timestamp) {
        return new AccountSnapshot(totalEquity, cashBalance, timestamp, totalEquity, totalEquity, false);
    }

    /** Start-of-day equity, falling back to current equity when the caller did not supply one. */
    public double effectiveStartOfDayEquity() {
        return startOfDayEquity > 0 ? startOfDayEquity : totalEquity;
    }

    /**
     * Realized plus unrealized P&amp;L since the open of the trading day. Losses carried in
     * from earlier days are already inside the start-of-day figure and do not count again.
     */
    public double dayPnl() {
        return totalEquity - effectiveStartOfDayEquity();
    }

    /** Peak equity, never below current equity. */
    public double effectivePeakEquity() {
        return Math.max(peakEquity, totalEquity);
    }
}
