package com.tradeguard.risk.model;

import lombok.Builder;

/**
 * Read-only risk status for dashboards. Percentages are expressed as fractions of equity.
 * {@code valueAtRisk} and {@code beta} are NaN when history is insufficient.
 * {@code dailyPnl} runs from the open of the day, {@code unrealizedPnl} from each entry.
 */
@Builder
public record RiskSummary(
        double portfolioValue,
        double dailyPnl,
        double dailyPnlPct,
        double unrealizedPnl,
        double currentDrawdownPct,
        double exposure,
        double exposurePct,
        int openPositions,
        double dailyLossLimit,
        double maxDrawdownLimit,
        double maxExposureLimit,
        double valueAtRisk,
        double beta,
        boolean dailyLossBreached,
        boolean drawdownHalted,
        boolean canTrade
) {
}
