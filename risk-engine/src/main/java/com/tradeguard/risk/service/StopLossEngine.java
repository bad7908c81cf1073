package com.tradeguard.risk.service;

import com.tradeguard.risk.model.ExitDecision;
import com.tradeguard.risk.model.ExitReason;
import com.tradeguard.risk.model.PositionSide;
import com.tradeguard.risk.model.PositionState;
import com.tradeguard.risk.model.RiskLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;
import static com.tradeguard.risk.util.RiskPreconditions.requirePositive;

/**
 * Exit rules for an open position, checked in a fixed order: take-profit, trailing stop,
 * fixed stop-loss, time stop. The first rule that fires supplies the reason.
 *
 * <p>The high-water mark is the only state the rules need between ticks. It is returned in
 * every {@link ExitDecision} and the caller passes it back on the next call.
 *
 * <p>A missing mark starts at the entry price, so the trailing stop is armed from entry.
 * When {@code trailingStopPct} is tighter than {@code stopLossPct}, a position that never
 * moved in its favour exits as {@link ExitReason#TRAILING_STOP} before the fixed stop is
 * reached.
 */
@Service
@Slf4j
public class StopLossEngine {

    public ExitDecision evaluate(double entryPrice, double currentPrice, PositionSide side,
                                 Instant entryTime, Instant now, RiskLimits limits, Double highWaterMark) {
        requirePositive("entryPrice", entryPrice);
        requirePositive("currentPrice", currentPrice);
        requireNonNull("side", side);
        requireNonNull("limits", limits);

        double unrealizedReturn = unrealizedReturn(entryPrice, currentPrice, side);
        double mark = updateHighWaterMark(highWaterMark != null ? highWaterMark : entryPrice, currentPrice, side);

        // 1. Take-profit
        if (limits.takeProfitPct() > 0 && unrealizedReturn >= limits.takeProfitPct()) {
            return exit(ExitReason.TAKE_PROFIT, unrealizedReturn, mark);
        }

        // 2. Trailing stop
        if (limits.trailingStopPct() > 0 && retraceFromMark(mark, currentPrice, side) >= limits.trailingStopPct()) {
            return exit(ExitReason.TRAILING_STOP, unrealizedReturn, mark);
        }

        // 3. Fixed stop-loss
        if (limits.stopLossPct() > 0 && unrealizedReturn <= -limits.stopLossPct()) {
            return exit(ExitReason.STOP_LOSS, unrealizedReturn, mark);
        }

        // 4. Time stop, only for positions that are not in profit
        if (entryTime != null && now != null && unrealizedReturn <= 0
                && !Duration.between(entryTime, now).minus(limits.maxHoldingDuration()).isNegative()) {
            return exit(ExitReason.TIME_STOP, unrealizedReturn, mark);
        }

        return ExitDecision.hold(unrealizedReturn, mark);
    }

    /**
     * Evaluates a tracked position and returns the decision with a copy of the position
     * carrying the updated high-water mark.
     */
    public Evaluation evaluate(PositionState position, double currentPrice, Instant now, RiskLimits limits) {
        requireNonNull("position", position);
        ExitDecision decision = evaluate(position.entryPrice(), currentPrice, position.side(),
                position.entryTime(), now, limits, position.highWaterMark());
        return new Evaluation(decision, position.withHighWaterMark(decision.highWaterMark()));
    }

    public double unrealizedReturn(double entryPrice, double currentPrice, PositionSide side) {
        return (currentPrice - entryPrice) / entryPrice * side.direction();
    }

    public double updateHighWaterMark(double previousMark, double currentPrice, PositionSide side) {
        return side == PositionSide.LONG
                ? Math.max(previousMark, currentPrice)
                : Math.min(previousMark, currentPrice);
    }

    /**
     * Fractional move against the position measured from the mark; never negative.
     */
    public double retraceFromMark(double mark, double currentPrice, PositionSide side) {
        double retrace = side == PositionSide.LONG
                ? (mark - currentPrice) / mark
                : (currentPrice - mark) / mark;
        return Math.max(retrace, 0.0);
    }

    private ExitDecision exit(ExitReason reason, double unrealizedReturn, double mark) {
        ExitDecision decision = ExitDecision.exit(reason, unrealizedReturn, mark);
        log.info("Exit triggered: {}", decision.message());
        return decision;
    }

    public record Evaluation(ExitDecision decision, PositionState position) {}
}
