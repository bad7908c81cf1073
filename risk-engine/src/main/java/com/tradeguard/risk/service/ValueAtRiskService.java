package com.tradeguard.risk.service;

import com.tradeguard.risk.util.ReturnSeries;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

import static com.tradeguard.risk.util.RiskPreconditions.requirePositive;
import static com.tradeguard.risk.util.RiskPreconditions.requireSeries;

/**
 * Historical-simulation VaR and expected shortfall over a window of period returns.
 */
@Service
public class ValueAtRiskService {

    /**
     * Nearest-rank {@code (1 - confidence)} percentile of the last {@code lookback} returns,
     * scaled by equity. Empty when fewer than {@code lookback} returns are available.
     */
    public Optional<VarEstimate> calculate(List<Double> returns, double confidence, int lookback, double equity) {
        requireSeries("returns", returns);
        requirePositive("equity", equity);
        List<Double> window = ReturnSeries.tail(returns, lookback);
        if (window == null || window.isEmpty()) {
            return Optional.empty();
        }
        List<Double> sorted = window.stream().sorted().toList();
        int tailCount = tailCount(confidence, sorted.size());
        double percentileReturn = sorted.get(tailCount - 1);
        double expectedShortfall = sorted.subList(0, tailCount).stream()
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(percentileReturn);
        return Optional.of(new VarEstimate(
                confidence,
                percentileReturn,
                Math.max(0.0, -percentileReturn * equity),
                expectedShortfall,
                Math.max(0.0, -expectedShortfall * equity),
                sorted.size()
        ));
    }

    /**
     * Mean of the worst {@code (1 - confidence)} share of returns, at least one observation.
     */
    public double cvar(List<Double> returns, double confidence) {
        if (returns == null || returns.isEmpty()) {
            return 0.0;
        }
        List<Double> sorted = requireSeries("returns", returns).stream().sorted().toList();
        List<Double> tail = sorted.subList(0, tailCount(confidence, sorted.size()));
        return tail.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }

    private int tailCount(double confidence, int size) {
        int tailCount = (int) Math.ceil((1.0 - confidence) * size - 1e-9);
        return Math.min(Math.max(tailCount, 1), size);
    }

    /**
     * @param percentileReturn  return at the VaR percentile (negative for a loss)
     * @param lossAmount        one-period loss threshold in account currency, never negative
     * @param expectedShortfall mean return beyond the percentile
     * @param shortfallAmount   expected shortfall in account currency
     * @param observations      returns used
     */
    public record VarEstimate(
            double confidence,
            double percentileReturn,
            double lossAmount,
            double expectedShortfall,
            double shortfallAmount,
            int observations
    ) {}
}
