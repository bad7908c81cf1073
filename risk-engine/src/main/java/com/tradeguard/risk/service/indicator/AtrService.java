package com.tradeguard.risk.service.indicator;

import com.tradeguard.risk.exception.InvalidInputException;
import com.tradeguard.risk.model.Candle;
import com.tradeguard.risk.model.SizingParams;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;

/**
 * Average true range, the volatility input for volatility-adjusted sizing.
 *
 * <p>The first {@code period} true ranges are averaged to seed the value, after which each
 * range is folded in with Wilder smoothing: {@code atr = (atr * (period - 1) + tr) / period}.
 */
@Slf4j
@Service
public class AtrService {

    public static final int DEFAULT_PERIOD = 14;

    public Optional<AtrResult> calculate(List<Candle> candles) {
        return calculate(candles, DEFAULT_PERIOD);
    }

    /**
     * Empty until {@code period + 1} candles (oldest first) are available.
     */
    public Optional<AtrResult> calculate(List<Candle> candles, int period) {
        requireNonNull("candles", candles);
        if (period < 1) {
            throw new InvalidInputException("period", period, "must be at least 1");
        }
        if (candles.size() < period + 1) {
            log.debug("ATR undetermined: {} candles for a period of {}", candles.size(), period);
            return Optional.empty();
        }

        Candle previous = requireNonNull("candles[0]", candles.get(0));
        double seed = 0.0;
        double atr = 0.0;
        for (int i = 1; i < candles.size(); i++) {
            Candle current = requireNonNull("candles[" + i + "]", candles.get(i));
            double range = trueRange(previous, current);
            if (i < period) {
                seed += range;
            } else if (i == period) {
                atr = (seed + range) / period;
            } else {
                atr = (atr * (period - 1) + range) / period;
            }
            previous = current;
        }

        double lastClose = previous.close();
        return Optional.of(new AtrResult(atr, lastClose > 0 ? atr / lastClose : 0.0, period));
    }

    /**
     * Copies {@code tradeStats} with the ATR of {@code candles} as its volatility. When the
     * ATR is undetermined the volatility is left unset, so volatility sizing falls back to
     * the fixed fraction.
     */
    public SizingParams withVolatility(List<Candle> candles, SizingParams tradeStats) {
        SizingParams base = tradeStats != null ? tradeStats : SizingParams.NONE;
        return calculate(candles)
                .map(result -> new SizingParams(result.atr(), base.winRate(), base.avgWin(), base.avgLoss()))
                .orElse(new SizingParams(null, base.winRate(), base.avgWin(), base.avgLoss()));
    }

    /**
     * Largest of the bar's own range and the gaps from the previous close.
     */
    static double trueRange(Candle previous, Candle current) {
        double gapHigh = Math.abs(current.high() - previous.close());
        double gapLow = Math.abs(current.low() - previous.close());
        return Math.max(current.high() - current.low(), Math.max(gapHigh, gapLow));
    }

    /**
     * @param atr         average true range in price units
     * @param relativeAtr ATR as a fraction of the last close
     * @param period      smoothing period used
     */
    public record AtrResult(double atr, double relativeAtr, int period) {}
}
