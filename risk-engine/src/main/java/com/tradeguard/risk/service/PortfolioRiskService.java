package com.tradeguard.risk.service;

import com.tradeguard.risk.model.AccountSnapshot;
import com.tradeguard.risk.model.PortfolioSnapshot;
import com.tradeguard.risk.model.PositionState;
import com.tradeguard.risk.model.RiskDecision;
import com.tradeguard.risk.model.RiskLimits;
import com.tradeguard.risk.model.RiskReason;
import com.tradeguard.risk.service.risk.CircuitBreakerService;
import com.tradeguard.risk.util.ReturnSeries;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

import static com.tradeguard.risk.util.RiskPreconditions.requireSeries;

/**
 * Portfolio-level checks and analytics over a {@link PortfolioSnapshot}.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PortfolioRiskService {

    private final CorrelationService correlationService;
    private final ValueAtRiskService valueAtRiskService;
    private final CircuitBreakerService circuitBreakerService;

    // --- exposure and concentration ---

    public double grossExposure(PortfolioSnapshot portfolio) {
        double total = 0.0;
        for (PositionState position : portfolio.positions()) {
            total += position.notional(portfolio.markPrice(position));
        }
        return total;
    }

    /** Gross exposure as a fraction of equity. */
    public double exposureRatio(PortfolioSnapshot portfolio, double equity) {
        return grossExposure(portfolio) / equity;
    }

    /**
     * Blocks an open when current plus proposed exposure would exceed the portfolio limit.
     * Existing positions are never reduced by this check.
     */
    public RiskDecision checkExposure(PortfolioSnapshot portfolio, double proposedNotional, double equity, RiskLimits limits) {
        double ratio = (grossExposure(portfolio) + proposedNotional) / equity;
        if (ratio > limits.maxPortfolioExposure()) {
            return RiskDecision.deny(RiskReason.EXPOSURE_LIMIT, ratio, limits.maxPortfolioExposure());
        }
        return RiskDecision.allow();
    }

    public RiskDecision checkPositionSize(double proposedNotional, double equity, RiskLimits limits) {
        double weight = proposedNotional / equity;
        if (weight > limits.maxPositionSize()) {
            return RiskDecision.deny(RiskReason.POSITION_SIZE_LIMIT, weight, limits.maxPositionSize());
        }
        return RiskDecision.allow();
    }

    /**
     * Weight of the symbol after the trade, counting what is already held in it.
     */
    public RiskDecision checkPositionWeight(String symbol, PortfolioSnapshot portfolio, double proposedNotional,
                                            double equity, RiskLimits limits) {
        double held = portfolio.positions().stream()
                .filter(p -> p.symbol().equals(symbol))
                .mapToDouble(p -> p.notional(portfolio.markPrice(p)))
                .sum();
        double weight = (held + proposedNotional) / equity;
        if (weight > limits.maxSinglePositionWeight()) {
            return RiskDecision.deny(RiskReason.POSITION_WEIGHT_LIMIT, weight, limits.maxSinglePositionWeight());
        }
        return RiskDecision.allow();
    }

    // --- correlation ---

    /**
     * Correlation of the candidate with every other held symbol. An entry is empty when
     * either side lacks {@code correlationLookback} returns.
     */
    public Map<String, OptionalDouble> correlationsWith(String symbol, PortfolioSnapshot portfolio, RiskLimits limits) {
        Map<String, OptionalDouble> correlations = new LinkedHashMap<>();
        List<Double> candidate = portfolio.returnsFor(symbol);
        for (PositionState position : portfolio.positions()) {
            String held = position.symbol();
            if (held.equals(symbol) || correlations.containsKey(held)) {
                continue;
            }
            List<Double> existing = portfolio.returnsFor(held);
            if (candidate == null || existing == null) {
                correlations.put(held, OptionalDouble.empty());
                continue;
            }
            correlations.put(held, correlationService.correlation(candidate, existing, limits.correlationLookback()));
        }
        return correlations;
    }

    /**
     * Any correlation whose magnitude is above the limit blocks the trade, in either
     * direction. A correlation that cannot be determined blocks as well.
     */
    public RiskDecision checkCorrelation(String symbol, PortfolioSnapshot portfolio, RiskLimits limits) {
        for (Map.Entry<String, OptionalDouble> entry : correlationsWith(symbol, portfolio, limits).entrySet()) {
            OptionalDouble correlation = entry.getValue();
            if (correlation.isEmpty()) {
                log.warn("Correlation {} vs {} undetermined, need {} returns", symbol, entry.getKey(), limits.correlationLookback());
                return RiskDecision.deny(RiskReason.CORRELATION_UNDETERMINED,
                        symbol + " vs " + entry.getKey(), Double.NaN, limits.maxCorrelation());
            }
            if (Math.abs(correlation.getAsDouble()) > limits.maxCorrelation()) {
                log.warn("High correlation detected: {} vs {} = {}", symbol, entry.getKey(),
                        String.format("%.2f", correlation.getAsDouble()));
                return RiskDecision.deny(RiskReason.CORRELATION_LIMIT,
                        String.format("%s vs %s = %.2f (limit %.2f)", symbol, entry.getKey(),
                                correlation.getAsDouble(), limits.maxCorrelation()),
                        correlation.getAsDouble(), limits.maxCorrelation());
            }
        }
        return RiskDecision.allow();
    }

    public CorrelationService.CorrelationMatrix correlationMatrix(PortfolioSnapshot portfolio, RiskLimits limits) {
        Map<String, List<Double>> held = new LinkedHashMap<>();
        for (PositionState position : portfolio.positions()) {
            List<Double> series = portfolio.returnsFor(position.symbol());
            if (series != null) {
                held.put(position.symbol(), series);
            }
        }
        return correlationService.buildCorrelationMatrix(held, limits.correlationLookback());
    }

    // --- circuit breakers ---

    public RiskDecision checkDailyLoss(AccountSnapshot account, RiskLimits limits) {
        CircuitBreakerService.GuardDecision guard = circuitBreakerService.checkDailyLoss(account, limits);
        if (!guard.allowed()) {
            return RiskDecision.deny(RiskReason.DAILY_LOSS_LIMIT, guard.observed(), guard.limit());
        }
        return RiskDecision.allow();
    }

    public RiskDecision checkDrawdown(AccountSnapshot account, RiskLimits limits) {
        CircuitBreakerService.GuardDecision guard = circuitBreakerService.checkDrawdown(account, limits);
        if (!guard.allowed()) {
            return RiskDecision.deny(RiskReason.DRAWDOWN_HALT, guard.reason(), guard.observed(), guard.limit());
        }
        return RiskDecision.allow();
    }

    // --- VaR and beta ---

    /**
     * Value-weighted portfolio return series over the last {@code window} periods. Empty
     * when a held symbol has no series or fewer than {@code window} returns.
     */
    public Optional<List<Double>> portfolioReturns(PortfolioSnapshot portfolio, int window) {
        double gross = grossExposure(portfolio);
        if (portfolio.positions().isEmpty() || gross <= 0) {
            return Optional.of(List.of());
        }
        double[] combined = new double[window];
        for (PositionState position : portfolio.positions()) {
            List<Double> series = portfolio.returnsFor(position.symbol());
            if (series == null) {
                return Optional.empty();
            }
            List<Double> recent = ReturnSeries.tail(requireSeries(position.symbol(), series), window);
            if (recent == null) {
                return Optional.empty();
            }
            // signed weight: a short gains when the symbol falls
            double weight = position.notional(portfolio.markPrice(position)) / gross * position.side().direction();
            for (int i = 0; i < window; i++) {
                combined[i] += weight * recent.get(i);
            }
        }
        List<Double> returns = new ArrayList<>(window);
        for (double value : combined) {
            returns.add(value);
        }
        return Optional.of(returns);
    }

    /**
     * One-period historical VaR of the current holdings. An empty portfolio has zero VaR;
     * missing history makes the estimate undetermined.
     */
    public Optional<ValueAtRiskService.VarEstimate> valueAtRisk(PortfolioSnapshot portfolio, double equity, RiskLimits limits) {
        Optional<List<Double>> returns = portfolioReturns(portfolio, limits.varLookback());
        if (returns.isEmpty()) {
            return Optional.empty();
        }
        if (returns.get().isEmpty()) {
            return Optional.of(new ValueAtRiskService.VarEstimate(limits.varConfidence(), 0.0, 0.0, 0.0, 0.0, 0));
        }
        return valueAtRiskService.calculate(returns.get(), limits.varConfidence(), limits.varLookback(), equity);
    }

    public OptionalDouble beta(PortfolioSnapshot portfolio, RiskLimits limits) {
        Optional<List<Double>> returns = portfolioReturns(portfolio, limits.betaWindow());
        if (returns.isEmpty()) {
            return OptionalDouble.empty();
        }
        if (returns.get().isEmpty()) {
            return OptionalDouble.of(0.0);
        }
        return beta(returns.get(), portfolio.benchmarkReturns(), limits.betaWindow());
    }

    /**
     * OLS slope of {@code returns} regressed on {@code benchmark} over the last
     * {@code window} periods. Empty when either series is too short or the benchmark is flat.
     */
    public OptionalDouble beta(List<Double> returns, List<Double> benchmark, int window) {
        requireSeries("returns", returns);
        requireSeries("benchmark", benchmark);
        List<Double> y = ReturnSeries.tail(returns, window);
        List<Double> x = ReturnSeries.tail(benchmark, window);
        if (x == null || y == null) {
            return OptionalDouble.empty();
        }
        double meanX = ReturnSeries.mean(x);
        double meanY = ReturnSeries.mean(y);
        double covariance = 0.0;
        double variance = 0.0;
        for (int i = 0; i < window; i++) {
            double dx = x.get(i) - meanX;
            covariance += dx * (y.get(i) - meanY);
            variance += dx * dx;
        }
        if (variance == 0.0) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(covariance / variance);
    }
}
