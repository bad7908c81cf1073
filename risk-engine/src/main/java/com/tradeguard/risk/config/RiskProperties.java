package com.tradeguard.risk.config;

import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.SizingMode;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Binds the {@code risk.*} settings. Relaxed binding means {@code risk.max_position_size},
 * {@code risk.max-position-size} and {@code RISK_MAXPOSITIONSIZE} all land here.
 */
@ConfigurationProperties(prefix = "risk")
@Data
@Validated
public class RiskProperties {

    @PositiveOrZero
    private double maxPositionSize = 0.02;

    @PositiveOrZero
    private double maxPortfolioExposure = 0.5;

    @PositiveOrZero
    private double maxSinglePositionWeight = 0.10;

    @DecimalMin("-1.0")
    @DecimalMax("1.0")
    private double maxCorrelation = 0.7;

    @PositiveOrZero
    private double dailyLossLimit = 0.05;

    @PositiveOrZero
    private double maxDrawdownLimit = 0.15;

    @PositiveOrZero
    private double stopLossPercentage = 0.02;

    @PositiveOrZero
    private double takeProfitPercentage = 0.05;

    @PositiveOrZero
    private double trailingStopPercentage = 0.03;

    @NotNull
    private Duration maxHoldingDuration = Duration.ofHours(24);

    @Positive
    @DecimalMax(value = "1.0", inclusive = false)
    private double varConfidence = 0.95;

    private Kelly kelly = new Kelly();
    private Sizing sizing = new Sizing();
    private Lookback lookback = new Lookback();

    @Data
    public static class Kelly {
        @Positive
        @DecimalMax("1.0")
        private double fraction = 0.5;

        @PositiveOrZero
        private double cap = 0.20;
    }

    @Data
    public static class Sizing {
        @NotNull
        private SizingMode mode = SizingMode.FIXED_FRACTION;

        @PositiveOrZero
        private double volatilityTarget = 0.02;
    }

    @Data
    public static class Lookback {
        @Min(2)
        private int correlation = 30;

        @Min(1)
        private int valueAtRisk = 30;

        @Min(2)
        private int beta = 90;
    }

    public RiskLimits toLimits() {
        return RiskLimits.builder()
                .maxPositionSize(maxPositionSize)
                .maxPortfolioExposure(maxPortfolioExposure)
                .maxSinglePositionWeight(maxSinglePositionWeight)
                .maxCorrelation(maxCorrelation)
                .dailyLossLimit(dailyLossLimit)
                .maxDrawdownLimit(maxDrawdownLimit)
                .stopLossPct(stopLossPercentage)
                .trailingStopPct(trailingStopPercentage)
                .takeProfitPct(takeProfitPercentage)
                .maxHoldingDuration(maxHoldingDuration)
                .varConfidence(varConfidence)
                .kellyMultiplier(kelly.getFraction())
                .kellyCap(kelly.getCap())
                .volatilityTarget(sizing.getVolatilityTarget())
                .correlationLookback(lookback.getCorrelation())
                .varLookback(lookback.getValueAtRisk())
                .betaWindow(lookback.getBeta())
                .defaultSizingMode(sizing.getMode())
                .build();
    }
}
