package com.tradeguard.risk.service;

import com.tradeguard.risk.exception.InvalidInputException;
import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.SizingMode;
import com.tradeguard.risk.model.SizingParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import static com.tradeguard.risk.util.RiskPreconditions.requireFraction;
import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;
import static com.tradeguard.risk.util.RiskPreconditions.requirePositive;

/**
 * Turns a trade idea into a share/contract quantity. Every mode is capped at
 * {@code floor(equity * maxPositionSize / price)}.
 */
@Service
@Slf4j
public class PositionSizingEngine {

    public int size(String symbol, double price, double accountEquity, RiskLimits limits,
                    SizingMode mode, SizingParams params) {
        requirePositive("price", price);
        requireNonNull("limits", limits);
        SizingMode effectiveMode = mode != null ? mode : limits.defaultSizingMode();
        SizingParams effectiveParams = params != null ? params : SizingParams.NONE;

        if (!Double.isFinite(accountEquity) || accountEquity <= 0) {
            log.warn("Sizing {}: no equity to size against ({}), returning 0", symbol, accountEquity);
            return 0;
        }

        int ceiling = fixedFractionSize(price, accountEquity, limits.maxPositionSize());
        int quantity = switch (effectiveMode) {
            case FIXED_FRACTION -> ceiling;
            case VOLATILITY_ADJUSTED -> volatilityAdjustedSize(price, accountEquity, limits, effectiveParams.volatility());
            case KELLY -> kellySize(price, accountEquity, limits, effectiveParams);
            case MOST_CONSERVATIVE -> mostConservativeSize(price, accountEquity, limits, effectiveParams);
        };

        if (quantity > ceiling) {
            log.debug("Sizing {}: {} capped by max position size {} -> {}", symbol, quantity, limits.maxPositionSize(), ceiling);
            quantity = ceiling;
        }
        quantity = Math.max(quantity, 0);
        log.info("Sizing {}: mode={} price={} equity={} qty={}", symbol, effectiveMode, price, accountEquity, quantity);
        return quantity;
    }

    /**
     * Raw Kelly fraction {@code W - (1 - W) / R} where R is the payoff ratio.
     */
    public double kellyFraction(double winRate, double avgWin, double avgLoss) {
        requireFraction("winRate", winRate);
        requirePositive("avgWin", avgWin);
        requirePositive("avgLoss", avgLoss);
        double payoffRatio = avgWin / avgLoss;
        return winRate - (1.0 - winRate) / payoffRatio;
    }

    /**
     * Kelly fraction after the fractional multiplier and cap; 0 when there is no edge.
     */
    public double scaledKellyFraction(double winRate, double avgWin, double avgLoss, RiskLimits limits) {
        double raw = kellyFraction(winRate, avgWin, avgLoss);
        if (raw <= 0) {
            return 0.0;
        }
        return Math.min(raw * limits.kellyMultiplier(), limits.kellyCap());
    }

    int fixedFractionSize(double price, double equity, double fraction) {
        return (int) Math.floor(equity * fraction / price);
    }

    private int volatilityAdjustedSize(double price, double equity, RiskLimits limits, Double volatility) {
        if (volatility == null || volatility == 0.0) {
            return fixedFractionSize(price, equity, limits.maxPositionSize());
        }
        if (!Double.isFinite(volatility) || volatility < 0) {
            throw new InvalidInputException("volatility", volatility, "must be a non-negative finite number");
        }
        double normalizedVolatility = volatility / price;
        double scale = Math.min(1.0, limits.volatilityTarget() / normalizedVolatility);
        log.debug("Volatility sizing: atr={} normalized={} target={} scale={}",
                volatility, normalizedVolatility, limits.volatilityTarget(), scale);
        return fixedFractionSize(price, equity, limits.maxPositionSize() * scale);
    }

    private int kellySize(double price, double equity, RiskLimits limits, SizingParams params) {
        if (!params.hasTradeStats()) {
            throw new InvalidInputException("params", params, "Kelly sizing needs winRate, avgWin and avgLoss");
        }
        double fraction = scaledKellyFraction(params.winRate(), params.avgWin(), params.avgLoss(), limits);
        if (fraction == 0.0) {
            log.info("Kelly sizing: no statistical edge (winRate={}, avgWin={}, avgLoss={})",
                    params.winRate(), params.avgWin(), params.avgLoss());
            return 0;
        }
        return fixedFractionSize(price, equity, fraction);
    }

    private int mostConservativeSize(double price, double equity, RiskLimits limits, SizingParams params) {
        int size = fixedFractionSize(price, equity, limits.maxPositionSize());
        if (params.hasVolatility()) {
            size = Math.min(size, volatilityAdjustedSize(price, equity, limits, params.volatility()));
        }
        if (params.hasTradeStats()) {
            size = Math.min(size, kellySize(price, equity, limits, params));
        }
        return size;
    }
}
