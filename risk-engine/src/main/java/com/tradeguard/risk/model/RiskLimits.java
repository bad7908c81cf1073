package com.tradeguard.risk.model;

import com.tradeguard.risk.exception.InvalidInputException;
import lombok.Builder;

import java.time.Duration;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNegative;

/**
 * Immutable risk configuration. All fractions are expressed against account equity
 * (0.02 = 2%).
 */
@Builder(toBuilder = true)
public record RiskLimits(
        double maxPositionSize,
        double maxPortfolioExposure,
        double maxSinglePositionWeight,
        double maxCorrelation,
        double dailyLossLimit,
        double maxDrawdownLimit,
        double stopLossPct,
        double trailingStopPct,
        double takeProfitPct,
        Duration maxHoldingDuration,
        double varConfidence,
        double kellyMultiplier,
        double kellyCap,
        double volatilityTarget,
        int correlationLookback,
        int varLookback,
        int betaWindow,
        SizingMode defaultSizingMode
) {

    public RiskLimits {
        requireNonNegative("maxPositionSize", maxPositionSize);
        requireNonNegative("maxPortfolioExposure", maxPortfolioExposure);
        requireNonNegative("maxSinglePositionWeight", maxSinglePositionWeight);
        requireNonNegative("dailyLossLimit", dailyLossLimit);
        requireNonNegative("maxDrawdownLimit", maxDrawdownLimit);
        requireNonNegative("stopLossPct", stopLossPct);
        requireNonNegative("trailingStopPct", trailingStopPct);
        requireNonNegative("takeProfitPct", takeProfitPct);
        requireNonNegative("kellyCap", kellyCap);
        requireNonNegative("volatilityTarget", volatilityTarget);
        if (!Double.isFinite(maxCorrelation) || maxCorrelation < -1.0 || maxCorrelation > 1.0) {
            throw new InvalidInputException("maxCorrelation", maxCorrelation, "must be within [-1, 1]");
        }
        if (!(kellyMultiplier > 0.0 && kellyMultiplier <= 1.0)) {
            throw new InvalidInputException("kellyMultiplier", kellyMultiplier, "must be within (0, 1]");
        }
        if (!(varConfidence > 0.0 && varConfidence < 1.0)) {
            throw new InvalidInputException("varConfidence", varConfidence, "must be within (0, 1)");
        }
        if (maxHoldingDuration == null || maxHoldingDuration.isNegative()) {
            throw new InvalidInputException("maxHoldingDuration", maxHoldingDuration, "must be a non-negative duration");
        }
        if (correlationLookback < 2 || varLookback < 1 || betaWindow < 2) {
            throw new InvalidInputException("lookback",
                    correlationLookback + "/" + varLookback + "/" + betaWindow,
                    "correlation and beta windows need at least 2 periods, VaR at least 1");
        }
        if (defaultSizingMode == null) {
            defaultSizingMode = SizingMode.FIXED_FRACTION;
        }
    }

    public static RiskLimits defaults() {
        return RiskLimits.builder()
                .maxPositionSize(0.02)
                .maxPortfolioExposure(0.5)
                .maxSinglePositionWeight(0.10)
                .maxCorrelation(0.7)
                .dailyLossLimit(0.05)
                .maxDrawdownLimit(0.15)
                .stopLossPct(0.02)
                .trailingStopPct(0.03)
                .takeProfitPct(0.05)
                .maxHoldingDuration(Duration.ofHours(24))
                .varConfidence(0.95)
                .kellyMultiplier(0.5)
                .kellyCap(0.20)
                .volatilityTarget(0.02)
                .correlationLookback(30)
                .varLookback(30)
                .betaWindow(90)
                .defaultSizingMode(SizingMode.FIXED_FRACTION)
                .build();
    }
}
