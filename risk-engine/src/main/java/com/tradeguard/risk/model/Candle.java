package com.tradeguard.risk.model;

import java.time.LocalDateTime;

public record Candle(double open, double high, double low, double close, long volume, LocalDateTime timestamp) {
}
