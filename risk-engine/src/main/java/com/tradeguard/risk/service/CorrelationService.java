package com.tradeguard.risk.service;

import com.tradeguard.risk.util.ReturnSeries;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

import static com.tradeguard.risk.util.RiskPreconditions.requireSeries;

@Slf4j
@Service
public class CorrelationService {

    /**
     * Pearson correlation of the most recent {@code lookback} values of two return series.
     * Empty when either series is shorter than the lookback. A flat window has no co-movement
     * and reports 0.
     * -1: Perfect negative correlation
     *  0: No correlation
     *  1: Perfect positive correlation
     */
    public OptionalDouble correlation(List<Double> series1, List<Double> series2, int lookback) {
        requireSeries("series1", series1);
        requireSeries("series2", series2);
        List<Double> window1 = ReturnSeries.tail(series1, lookback);
        List<Double> window2 = ReturnSeries.tail(series2, lookback);
        if (window1 == null || window2 == null) {
            log.debug("Correlation undetermined: {} and {} returns for a lookback of {}",
                    series1.size(), series2.size(), lookback);
            return OptionalDouble.empty();
        }

        double mean1 = ReturnSeries.mean(window1);
        double mean2 = ReturnSeries.mean(window2);

        double covariance = 0;
        double variance1 = 0;
        double variance2 = 0;

        for (int i = 0; i < lookback; i++) {
            double diff1 = window1.get(i) - mean1;
            double diff2 = window2.get(i) - mean2;
            covariance += diff1 * diff2;
            variance1 += diff1 * diff1;
            variance2 += diff2 * diff2;
        }

        if (variance1 == 0 || variance2 == 0) {
            return OptionalDouble.of(0.0);
        }

        double correlation = covariance / Math.sqrt(variance1 * variance2);
        return OptionalDouble.of(Math.max(-1.0, Math.min(1.0, correlation)));
    }

    /**
     * Correlation matrix for a set of return series. Undetermined pairs are reported as NaN.
     */
    public CorrelationMatrix buildCorrelationMatrix(Map<String, List<Double>> returnSeries, int lookback) {
        List<String> symbols = new ArrayList<>(returnSeries.keySet());
        symbols.sort(null);
        int size = symbols.size();
        double[][] matrix = new double[size][size];

        for (int i = 0; i < size; i++) {
            matrix[i][i] = 1.0;
            for (int j = i + 1; j < size; j++) {
                double value = correlation(returnSeries.get(symbols.get(i)), returnSeries.get(symbols.get(j)), lookback)
                        .orElse(Double.NaN);
                matrix[i][j] = value;
                matrix[j][i] = value;
            }
        }

        return new CorrelationMatrix(List.copyOf(symbols), matrix);
    }

    public record CorrelationMatrix(List<String> symbols, double[][] matrix) {

        public double get(String a, String b) {
            int i = symbols.indexOf(a);
            int j = symbols.indexOf(b);
            if (i < 0 || j < 0) {
                return Double.NaN;
            }
            return matrix[i][j];
        }
    }
}
