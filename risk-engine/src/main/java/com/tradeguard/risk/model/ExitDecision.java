package com.tradeguard.risk.model;

/**
 * @param highWaterMark the mark after this price update; pass it into the next evaluation
 */
public record ExitDecision(
        boolean shouldExit,
        ExitReason reason,
        String message,
        double unrealizedReturn,
        double highWaterMark
) {

    public static ExitDecision exit(ExitReason reason, double unrealizedReturn, double highWaterMark) {
        String message = String.format("%s (%.2f%%)", reason.getDescription(), unrealizedReturn * 100.0);
        return new ExitDecision(true, reason, message, unrealizedReturn, highWaterMark);
    }

    public static ExitDecision hold(double unrealizedReturn, double highWaterMark) {
        return new ExitDecision(false, ExitReason.HOLD, ExitReason.HOLD.getDescription(), unrealizedReturn, highWaterMark);
    }
}
