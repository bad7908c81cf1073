package com.tradeguard.risk.service;

import com.tradeguard.risk.model.AccountSnapshot;
import com.tradeguard.risk.model.Candle;
import com.tradeguard.risk.model.ExitDecision;
import com.tradeguard.risk.model.PortfolioSnapshot;
import com.tradeguard.risk.model.PositionSide;
import com.tradeguard.risk.model.PositionState;
import com.tradeguard.risk.model.RiskDecision;
import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.RiskReason;
import com.tradeguard.risk.model.RiskSummary;
import com.tradeguard.risk.model.SizingMode;
import com.tradeguard.risk.model.SizingParams;
import com.tradeguard.risk.service.indicator.AtrService;
import com.tradeguard.risk.service.risk.CircuitBreakerService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNegative;
import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;
import static com.tradeguard.risk.util.RiskPreconditions.requirePositive;

/**
 * Entry point for the execution client and the position monitor.
 *
 * <p>Holds only the configured {@link RiskLimits} and stateless collaborators, so any
 * number of monitoring loops may call it concurrently. Every input is a snapshot owned by
 * the caller; nothing is mutated or retained.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class RiskManagementEngine {

    private final PositionSizingEngine positionSizingEngine;
    private final StopLossEngine stopLossEngine;
    private final PortfolioRiskService portfolioRiskService;
    private final CircuitBreakerService circuitBreakerService;
    private final AtrService atrService;
    private final RiskLimits configuredLimits;

    public RiskLimits limits() {
        return configuredLimits;
    }

    // --- sizing ---

    public int calculatePositionSize(String symbol, double price, double accountEquity, RiskLimits limits,
                                     SizingMode mode, SizingParams params) {
        return positionSizingEngine.size(symbol, price, accountEquity, limits, mode, params);
    }

    /** Sizes with the configured limits and the configured default mode. */
    public int calculatePositionSize(String symbol, double price, double accountEquity, SizingParams params) {
        return calculatePositionSize(symbol, price, accountEquity, configuredLimits, configuredLimits.defaultSizingMode(), params);
    }

    /**
     * Sizes from recent bars: the ATR of {@code candles} becomes the volatility input, and
     * {@code tradeStats} supplies the Kelly inputs when the mode needs them.
     */
    public int calculatePositionSize(String symbol, double price, double accountEquity, RiskLimits limits,
                                     SizingMode mode, List<Candle> candles, SizingParams tradeStats) {
        return calculatePositionSize(symbol, price, accountEquity, limits, mode,
                atrService.withVolatility(candles, tradeStats));
    }

    // --- pre-trade gate ---

    /**
     * Runs the pre-trade checks in order: drawdown halt, daily loss, portfolio exposure,
     * position size and weight, correlation. The first failing check decides.
     */
    public RiskDecision canOpenPosition(String symbol, PositionSide side, double proposedQuantity, double price,
                                        AccountSnapshot account, PortfolioSnapshot portfolio, RiskLimits limits) {
        requireNonNull("symbol", symbol);
        requireNonNull("side", side);
        requireNonNegative("proposedQuantity", proposedQuantity);
        requirePositive("price", price);
        requireNonNull("account", account);
        requireNonNull("limits", limits);
        PortfolioSnapshot holdings = portfolio != null ? portfolio : PortfolioSnapshot.empty();

        double equity = account.totalEquity();
        if (!Double.isFinite(equity) || equity <= 0) {
            return reject(symbol, side, RiskDecision.deny(RiskReason.INVALID_ACCOUNT, equity, 0.0));
        }
        double notional = proposedQuantity * price;

        List<Supplier<RiskDecision>> checks = List.of(
                () -> portfolioRiskService.checkDrawdown(account, limits),
                () -> portfolioRiskService.checkDailyLoss(account, limits),
                () -> portfolioRiskService.checkExposure(holdings, notional, equity, limits),
                () -> portfolioRiskService.checkPositionSize(notional, equity, limits),
                () -> portfolioRiskService.checkPositionWeight(symbol, holdings, notional, equity, limits),
                () -> portfolioRiskService.checkCorrelation(symbol, holdings, limits)
        );
        for (Supplier<RiskDecision> check : checks) {
            RiskDecision decision = check.get();
            if (!decision.allowed()) {
                return reject(symbol, side, decision);
            }
        }

        log.info("Risk check passed for {} {} {}@{}", symbol, side, proposedQuantity, price);
        return RiskDecision.allow();
    }

    public RiskDecision canOpenPosition(String symbol, PositionSide side, double proposedQuantity, double price,
                                        AccountSnapshot account, PortfolioSnapshot portfolio) {
        return canOpenPosition(symbol, side, proposedQuantity, price, account, portfolio, configuredLimits);
    }

    // --- in-trade monitor ---

    public ExitDecision shouldExitPosition(double entryPrice, double currentPrice, PositionSide side,
                                           Instant entryTime, Instant now, RiskLimits limits, Double highWaterMark) {
        return stopLossEngine.evaluate(entryPrice, currentPrice, side, entryTime, now, limits, highWaterMark);
    }

    /**
     * Evaluates an open position; the returned position copy carries the high-water mark to
     * pass in on the next tick.
     */
    public StopLossEngine.Evaluation shouldExitPosition(PositionState position, double currentPrice, Instant now,
                                                        RiskLimits limits) {
        return stopLossEngine.evaluate(position, currentPrice, now, limits);
    }

    public StopLossEngine.Evaluation shouldExitPosition(PositionState position, double currentPrice, Instant now) {
        return shouldExitPosition(position, currentPrice, now, configuredLimits);
    }

    // --- reporting ---

    public RiskSummary riskSummary(AccountSnapshot account, PortfolioSnapshot portfolio, RiskLimits limits) {
        requireNonNull("account", account);
        requireNonNull("limits", limits);
        PortfolioSnapshot holdings = portfolio != null ? portfolio : PortfolioSnapshot.empty();
        double equity = account.totalEquity();
        double startOfDay = account.effectiveStartOfDayEquity();
        double dailyPnl = account.dayPnl();
        double exposure = portfolioRiskService.grossExposure(holdings);

        boolean dailyBreached = !circuitBreakerService.checkDailyLoss(account, limits).allowed();
        boolean halted = !circuitBreakerService.checkDrawdown(account, limits).allowed();

        double var = Double.NaN;
        double beta = Double.NaN;
        if (equity > 0) {
            var = portfolioRiskService.valueAtRisk(holdings, equity, limits)
                    .map(ValueAtRiskService.VarEstimate::lossAmount)
                    .orElse(Double.NaN);
            beta = portfolioRiskService.beta(holdings, limits).orElse(Double.NaN);
        }

        return RiskSummary.builder()
                .portfolioValue(equity)
                .dailyPnl(dailyPnl)
                .dailyPnlPct(startOfDay > 0 ? dailyPnl / startOfDay : 0.0)
                .unrealizedPnl(circuitBreakerService.unrealizedPnl(holdings))
                .currentDrawdownPct(circuitBreakerService.drawdown(account))
                .exposure(exposure)
                .exposurePct(equity > 0 ? exposure / equity : 0.0)
                .openPositions(holdings.positions().size())
                .dailyLossLimit(limits.dailyLossLimit())
                .maxDrawdownLimit(limits.maxDrawdownLimit())
                .maxExposureLimit(limits.maxPortfolioExposure())
                .valueAtRisk(var)
                .beta(beta)
                .dailyLossBreached(dailyBreached)
                .drawdownHalted(halted)
                .canTrade(!dailyBreached && !halted)
                .build();
    }

    private RiskDecision reject(String symbol, PositionSide side, RiskDecision decision) {
        log.warn("Risk check failed for {} {}: {}", symbol, side, decision.message());
        return decision;
    }
}
