package com.tradeguard.risk.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;
import static com.tradeguard.risk.util.RiskPreconditions.requireSeries;

/**
 * Holdings plus the return history needed for correlation, VaR and beta. Return series are
 * ordered oldest first.
 */
public record PortfolioSnapshot(
        List<PositionState> positions,
        Map<String, Double> currentPrices,
        Map<String, List<Double>> returnSeries,
        List<Double> benchmarkReturns
) {

    public PortfolioSnapshot {
        if (positions == null) {
            positions = List.of();
        } else {
            for (int i = 0; i < positions.size(); i++) {
                requireNonNull("positions[" + i + "]", positions.get(i));
            }
            positions = List.copyOf(positions);
        }
        if (currentPrices == null) {
            currentPrices = Map.of();
        } else {
            currentPrices.forEach((symbol, price) -> {
                requireNonNull("currentPrices key", symbol);
                requireNonNull("currentPrices[" + symbol + "]", price);
            });
            currentPrices = Map.copyOf(currentPrices);
        }
        if (returnSeries == null) {
            returnSeries = Map.of();
        } else {
            Map<String, List<Double>> copies = new LinkedHashMap<>();
            returnSeries.forEach((symbol, series) ->
                    copies.put(requireNonNull("returnSeries key", symbol),
                            List.copyOf(requireSeries("returnSeries[" + symbol + "]", series))));
            returnSeries = Map.copyOf(copies);
        }
        benchmarkReturns = benchmarkReturns == null
                ? List.of()
                : List.copyOf(requireSeries("benchmarkReturns", benchmarkReturns));
    }

    public static PortfolioSnapshot empty() {
        return new PortfolioSnapshot(List.of(), Map.of(), Map.of(), List.of());
    }

    /** Mark price for a position, falling back to its entry price. */
    public double markPrice(PositionState position) {
        Double price = currentPrices.get(position.symbol());
        return price != null && price > 0 ? price : position.entryPrice();
    }

    public List<Double> returnsFor(String symbol) {
        return returnSeries.get(symbol);
    }
}
