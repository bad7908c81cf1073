package com.tradeguard.risk.util;

import com.tradeguard.risk.exception.InvalidInputException;

import java.util.List;

public final class RiskPreconditions {

    private RiskPreconditions() {
    }

    public static double requirePositive(String field, double value) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new InvalidInputException(field, value, "must be a positive finite number");
        }
        return value;
    }

    public static double requireNonNegative(String field, double value) {
        if (!Double.isFinite(value) || value < 0) {
            throw new InvalidInputException(field, value, "must be a non-negative finite number");
        }
        return value;
    }

    public static double requireFraction(String field, double value) {
        if (!Double.isFinite(value) || value < 0 || value > 1) {
            throw new InvalidInputException(field, value, "must be within [0, 1]");
        }
        return value;
    }

    public static <T> T requireNonNull(String field, T value) {
        if (value == null) {
            throw new InvalidInputException(field, null, "is required");
        }
        return value;
    }

    /**
     * A return series is malformed when it is null or holds a null or non-finite element.
     */
    public static List<Double> requireSeries(String field, List<Double> series) {
        if (series == null) {
            throw new InvalidInputException(field, null, "return series is required");
        }
        for (int i = 0; i < series.size(); i++) {
            Double value = series.get(i);
            if (value == null || !Double.isFinite(value)) {
                throw new InvalidInputException(field + "[" + i + "]", value, "must be a finite return");
            }
        }
        return series;
    }
}
