package com.tradeguard.risk.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum RiskReason {
    APPROVED("risk checks passed"),
    INVALID_ACCOUNT("invalid equity snapshot"),
    DRAWDOWN_HALT("max drawdown limit breached"),
    DAILY_LOSS_LIMIT("daily loss limit breached"),
    EXPOSURE_LIMIT("portfolio exposure limit breached"),
    POSITION_SIZE_LIMIT("position size exceeds max limit"),
    POSITION_WEIGHT_LIMIT("single position weight limit breached"),
    CORRELATION_LIMIT("correlation limit with existing positions breached"),
    CORRELATION_UNDETERMINED("correlation undetermined, insufficient return history");

    private final String description;
}
