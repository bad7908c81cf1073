package com.tradeguard.risk.model;

/**
 * Mode-specific sizing inputs. Fields a mode does not use may be null.
 *
 * @param volatility average true range (price units) for volatility-adjusted sizing
 * @param winRate    historical win rate in [0, 1]
 * @param avgWin     average winning trade, positive
 * @param avgLoss    average losing trade as a positive number
 */
public record SizingParams(Double volatility, Double winRate, Double avgWin, Double avgLoss) {

    public static final SizingParams NONE = new SizingParams(null, null, null, null);

    public static SizingParams volatility(double atr) {
        return new SizingParams(atr, null, null, null);
    }

    public static SizingParams kelly(double winRate, double avgWin, double avgLoss) {
        return new SizingParams(null, winRate, avgWin, avgLoss);
    }

    public boolean hasVolatility() {
        return volatility != null && volatility != 0.0;
    }

    public boolean hasTradeStats() {
        return winRate != null && avgWin != null && avgLoss != null;
    }
}
