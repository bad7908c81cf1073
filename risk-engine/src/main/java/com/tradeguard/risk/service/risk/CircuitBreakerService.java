package com.tradeguard.risk.service.risk;

import com.tradeguard.risk.model.AccountSnapshot;
import com.tradeguard.risk.model.PortfolioSnapshot;
import com.tradeguard.risk.model.PositionState;
import com.tradeguard.risk.model.RiskLimits;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

import static com.tradeguard.risk.util.RiskPreconditions.requireNonNull;

/**
 * Daily-loss and drawdown breakers computed from caller-held state.
 *
 * <p>The daily breaker compares the equity change since the open with the start-of-day
 * equity and blocks new entries for the rest of the trading day; exits keep working. The drawdown breaker halts all trading and latches: the caller stores the
 * {@code drawdownHalted} flag of the snapshot returned by
 * {@link #nextState(AccountSnapshot, RiskLimits)} and it stays set until
 * {@link #resetDrawdownHalt(AccountSnapshot, Instant)} is called. A zero limit disables its
 * breaker.
 */
@Service
@Slf4j
public class CircuitBreakerService {

    public record GuardDecision(boolean allowed, String reason, double observed, double limit) {}

    public GuardDecision checkDailyLoss(AccountSnapshot account, RiskLimits limits) {
        requireNonNull("account", account);
        requireNonNull("limits", limits);
        double startOfDay = account.effectiveStartOfDayEquity();
        if (startOfDay <= 0) {
            return new GuardDecision(true, "Start-of-day equity unavailable", 0.0, -limits.dailyLossLimit());
        }
        double dayPnl = account.dayPnl();
        double dayReturn = dayPnl / startOfDay;
        double limit = -limits.dailyLossLimit();
        if (limits.dailyLossLimit() > 0 && dayReturn <= limit) {
            log.warn("Daily loss limit reached: dayPnl={} ({}%) limit={}%",
                    dayPnl, String.format("%.2f", dayReturn * 100), String.format("%.2f", limit * 100));
            return new GuardDecision(false, "Daily loss limit reached", dayReturn, limit);
        }
        return new GuardDecision(true, "Allowed", dayReturn, limit);
    }

    public GuardDecision checkDrawdown(AccountSnapshot account, RiskLimits limits) {
        requireNonNull("account", account);
        requireNonNull("limits", limits);
        double drawdown = drawdown(account);
        if (account.drawdownHalted()) {
            return new GuardDecision(false, "Drawdown halt latched, manual reset required", drawdown, limits.maxDrawdownLimit());
        }
        if (limits.maxDrawdownLimit() > 0 && drawdown >= limits.maxDrawdownLimit()) {
            log.error("Max drawdown reached: drawdown={}% limit={}%. Halting trading.",
                    String.format("%.2f", drawdown * 100), String.format("%.2f", limits.maxDrawdownLimit() * 100));
            return new GuardDecision(false, "Max drawdown reached", drawdown, limits.maxDrawdownLimit());
        }
        return new GuardDecision(true, "Allowed", drawdown, limits.maxDrawdownLimit());
    }

    /**
     * Account state the caller should persist after this evaluation: the peak is carried
     * forward and the drawdown latch set once tripped.
     */
    public AccountSnapshot nextState(AccountSnapshot account, RiskLimits limits) {
        boolean halted = !checkDrawdown(account, limits).allowed();
        return account.toBuilder()
                .peakEquity(account.effectivePeakEquity())
                .drawdownHalted(halted)
                .build();
    }

    /**
     * Clears the drawdown latch and restarts peak tracking from current equity.
     */
    public AccountSnapshot resetDrawdownHalt(AccountSnapshot account, Instant resetAt) {
        requireNonNull("account", account);
        log.info("Drawdown halt reset at {}: new peak equity {}", resetAt, account.totalEquity());
        return account.toBuilder()
                .peakEquity(account.totalEquity())
                .drawdownHalted(false)
                .timestamp(resetAt != null ? resetAt : account.timestamp())
                .build();
    }

    public double drawdown(AccountSnapshot account) {
        double peak = account.effectivePeakEquity();
        if (peak <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (peak - account.totalEquity()) / peak);
    }

    /**
     * Open P&amp;L of all positions since entry, at mark prices.
     */
    public double unrealizedPnl(PortfolioSnapshot portfolio) {
        if (portfolio == null) {
            return 0.0;
        }
        double total = 0.0;
        for (PositionState position : portfolio.positions()) {
            total += position.unrealizedPnl(portfolio.markPrice(position));
        }
        return total;
    }
}
