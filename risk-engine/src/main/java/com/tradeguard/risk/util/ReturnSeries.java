package com.tradeguard.risk.util;

import com.tradeguard.risk.exception.InvalidInputException;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for period-return series. All series are ordered oldest first.
 */
public final class ReturnSeries {

    private ReturnSeries() {
    }

    /**
     * Simple returns {@code p[i] / p[i-1] - 1} from a price series.
     */
    public static List<Double> fromPrices(List<Double> prices) {
        RiskPreconditions.requireSeries("prices", prices);
        List<Double> returns = new ArrayList<>(Math.max(prices.size() - 1, 0));
        for (int i = 1; i < prices.size(); i++) {
            double previous = prices.get(i - 1);
            if (previous <= 0) {
                throw new InvalidInputException("prices[" + (i - 1) + "]", previous, "must be positive to derive a return");
            }
            returns.add(prices.get(i) / previous - 1.0);
        }
        return returns;
    }

    /**
     * The most recent {@code window} values, or null when the series is shorter.
     */
    public static List<Double> tail(List<Double> series, int window) {
        if (series == null || series.size() < window) {
            return null;
        }
        return series.subList(series.size() - window, series.size());
    }

    public static double mean(List<Double> series) {
        return series.stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
    }
}
