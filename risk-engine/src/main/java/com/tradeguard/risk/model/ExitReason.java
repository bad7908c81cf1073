package com.tradeguard.risk.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ExitReason {
    TAKE_PROFIT("target reached"),
    TRAILING_STOP("trailing stop hit"),
    STOP_LOSS("stop-loss"),
    TIME_STOP("time stop, no profit"),
    HOLD("hold");

    private final String description;
}
