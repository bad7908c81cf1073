package com.tradeguard.risk.service;

import com.tradeguard.risk.exception.InvalidInputException;
import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.SizingMode;
import com.tradeguard.risk.model.SizingParams;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PositionSizingEngineTest {

    private final PositionSizingEngine engine = new PositionSizingEngine();

    @Test
    void fixedFractionFloorsToWholeShares() {
        int qty = engine.size("AAPL", 175.0, 100_000, RiskLimits.defaults(), SizingMode.FIXED_FRACTION, SizingParams.NONE);

        assertThat(qty).isEqualTo(11);
    }

    @Test
    void kellyUsesHalfKellyUnderCap() {
        RiskLimits limits = RiskLimits.defaults().toBuilder().maxPositionSize(0.20).build();

        int qty = engine.size("AAPL", 175.0, 100_000, limits, SizingMode.KELLY, SizingParams.kelly(0.55, 150, 100));

        assertThat(engine.kellyFraction(0.55, 150, 100)).isCloseTo(0.25, within(1e-9));
        assertThat(engine.scaledKellyFraction(0.55, 150, 100, limits)).isCloseTo(0.125, within(1e-9));
        assertThat(qty).isEqualTo(71);
    }

    @Test
    void kellyIsStillBoundByMaxPositionSize() {
        int qty = engine.size("AAPL", 175.0, 100_000, RiskLimits.defaults(), SizingMode.KELLY, SizingParams.kelly(0.55, 150, 100));

        assertThat(qty).isEqualTo(11);
    }

    @Test
    void kellyFractionIsCapped() {
        RiskLimits limits = RiskLimits.defaults().toBuilder().kellyMultiplier(1.0).kellyCap(0.20).build();

        assertThat(engine.scaledKellyFraction(0.9, 200, 100, limits)).isEqualTo(0.20);
    }

    @Test
    void kellyReturnsZeroWithoutEdge() {
        RiskLimits limits = RiskLimits.defaults().toBuilder().maxPositionSize(0.20).build();

        // break-even win rate is avgLoss / (avgWin + avgLoss) = 0.5
        assertThat(engine.size("X", 50.0, 100_000, limits, SizingMode.KELLY, SizingParams.kelly(0.5, 100, 100))).isZero();
        assertThat(engine.size("X", 50.0, 100_000, limits, SizingMode.KELLY, SizingParams.kelly(0.3, 100, 100))).isZero();
        assertThat(engine.size("X", 50.0, 100_000, limits, SizingMode.KELLY, SizingParams.kelly(0.51, 100, 100))).isPositive();
    }

    @Test
    void kellyWithoutTradeStatsIsRejected() {
        assertThatThrownBy(() -> engine.size("X", 50.0, 100_000, RiskLimits.defaults(), SizingMode.KELLY, SizingParams.NONE))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void volatilityAdjustedScalesDownForVolatileSymbols() {
        RiskLimits limits = RiskLimits.defaults().toBuilder().maxPositionSize(0.20).volatilityTarget(0.02).build();

        // ATR of 4% against a 2% target halves the allocation
        int volatileQty = engine.size("X", 100.0, 100_000, limits, SizingMode.VOLATILITY_ADJUSTED, SizingParams.volatility(4.0));
        // ATR below target is never scaled up past the fixed fraction
        int calmQty = engine.size("X", 100.0, 100_000, limits, SizingMode.VOLATILITY_ADJUSTED, SizingParams.volatility(1.0));

        assertThat(volatileQty).isEqualTo(100);
        assertThat(calmQty).isEqualTo(200);
    }

    @Test
    void volatilityAdjustedFallsBackToFixedFractionWithoutVolatility() {
        int qty = engine.size("AAPL", 175.0, 100_000, RiskLimits.defaults(), SizingMode.VOLATILITY_ADJUSTED, SizingParams.NONE);

        assertThat(qty).isEqualTo(11);
    }

    @Test
    void negativeVolatilityIsRejected() {
        assertThatThrownBy(() -> engine.size("X", 100.0, 100_000, RiskLimits.defaults(),
                SizingMode.VOLATILITY_ADJUSTED, SizingParams.volatility(-1.0)))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void mostConservativeTakesSmallestSize() {
        RiskLimits limits = RiskLimits.defaults().toBuilder().maxPositionSize(0.20).build();
        SizingParams params = new SizingParams(4.0, 0.55, 150.0, 100.0);

        int qty = engine.size("AAPL", 175.0, 100_000, limits, SizingMode.MOST_CONSERVATIVE, params);

        assertThat(qty).isEqualTo(71);
    }

    @Test
    void neverExceedsCeilingInAnyMode() {
        SizingParams params = new SizingParams(0.5, 0.9, 500.0, 50.0);
        double[] prices = {0.37, 1.0, 17.3, 175.0, 999.99, 4321.5};
        double[] equities = {1_000, 25_000.5, 100_000, 3_750_000};
        RiskLimits limits = RiskLimits.defaults().toBuilder().kellyMultiplier(1.0).kellyCap(1.0).build();

        for (SizingMode mode : SizingMode.values()) {
            for (double price : prices) {
                for (double equity : equities) {
                    int qty = engine.size("X", price, equity, limits, mode, params);
                    assertThat(qty * price)
                            .as("%s price=%s equity=%s", mode, price, equity)
                            .isLessThanOrEqualTo(equity * limits.maxPositionSize());
                    assertThat(qty).isNotNegative();
                }
            }
        }
    }

    @Test
    void nonPositivePriceIsRejected() {
        assertThatThrownBy(() -> engine.size("X", 0.0, 100_000, RiskLimits.defaults(), SizingMode.FIXED_FRACTION, SizingParams.NONE))
                .isInstanceOf(InvalidInputException.class)
                .hasMessageContaining("price");
        assertThatThrownBy(() -> engine.size("X", -5.0, 100_000, RiskLimits.defaults(), SizingMode.FIXED_FRACTION, SizingParams.NONE))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void noEquityMeansNoPosition() {
        assertThat(engine.size("X", 10.0, 0.0, RiskLimits.defaults(), SizingMode.FIXED_FRACTION, SizingParams.NONE)).isZero();
        assertThat(engine.size("X", 10.0, -500.0, RiskLimits.defaults(), SizingMode.FIXED_FRACTION, SizingParams.NONE)).isZero();
    }

    @Test
    void nullModeUsesConfiguredDefault() {
        RiskLimits limits = RiskLimits.defaults().toBuilder()
                .maxPositionSize(0.20)
                .defaultSizingMode(SizingMode.KELLY)
                .build();

        assertThat(engine.size("AAPL", 175.0, 100_000, limits, null, SizingParams.kelly(0.55, 150, 100))).isEqualTo(71);
    }
}
