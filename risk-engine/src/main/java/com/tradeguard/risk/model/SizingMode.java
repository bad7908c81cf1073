package com.tradeguard.risk.model;

public enum SizingMode {
    FIXED_FRACTION,
    VOLATILITY_ADJUSTED,
    KELLY,
    // Smallest quantity among the methods whose parameters are supplied
    MOST_CONSERVATIVE
}
