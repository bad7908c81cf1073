package com.tradeguard.risk.model;

/**
 * Outcome of a pre-trade check. A denial is an ordinary result, not an error.
 *
 * @param observed the value that was tested (exposure ratio, daily return, correlation...)
 * @param limit    the limit it was tested against
 */
public record RiskDecision(
        boolean allowed,
        RiskReason reason,
        String message,
        double observed,
        double limit
) {

    public static RiskDecision allow() {
        return new RiskDecision(true, RiskReason.APPROVED, RiskReason.APPROVED.getDescription(), 0.0, 0.0);
    }

    public static RiskDecision deny(RiskReason reason, double observed, double limit) {
        String message = String.format("%s (%.4f vs limit %.4f)", reason.getDescription(), observed, limit);
        return new RiskDecision(false, reason, message, observed, limit);
    }

    public static RiskDecision deny(RiskReason reason, String detail, double observed, double limit) {
        return new RiskDecision(false, reason, reason.getDescription() + ": " + detail, observed, limit);
    }

    public String reasonText() {
        return reason.getDescription();
    }
}
