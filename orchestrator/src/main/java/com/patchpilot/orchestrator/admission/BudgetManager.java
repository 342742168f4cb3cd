package com.patchpilot.orchestrator.admission;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Daily, monthly and per-job spend caps.
 *
 * Like {@link RateLimiter}, an advisory gate evaluated at admission time.
 */
@Service
public class BudgetManager {

    private static final Logger log = LoggerFactory.getLogger(BudgetManager.class);

    private final UsageCounters               counters;
    private final PatchPilotProperties.Budget budget;

    public BudgetManager(UsageCounters counters, PatchPilotProperties props) {
        this.counters = counters;
        this.budget   = props.budget();
    }

    public BudgetCheck canProceed() {
        return canProceed(0.0);
    }

    /**
     * Denies when a cap is already reached, or when {@code estimatedCost}
     * on top of what was spent would go past one.
     */
    public BudgetCheck canProceed(double estimatedCost) {
        double dailySpent   = counters.spend(UsagePeriod.DAY);
        double monthlySpent = counters.spend(UsagePeriod.MONTH);
        double dailyLimit   = budget.dailyLimitUsd();
        double monthlyLimit = budget.monthlyLimitUsd();

        String reason = null;
        if (dailySpent >= dailyLimit) {
            reason = "Daily budget limit exceeded ($%.2f / $%.2f)".formatted(dailySpent, dailyLimit);
        } else if (monthlySpent >= monthlyLimit) {
            reason = "Monthly budget limit exceeded ($%.2f / $%.2f)".formatted(monthlySpent, monthlyLimit);
        } else if (estimatedCost > 0 && dailySpent + estimatedCost > dailyLimit) {
            reason = "Estimated cost $%.2f would exceed daily limit".formatted(estimatedCost);
        } else if (estimatedCost > 0 && monthlySpent + estimatedCost > monthlyLimit) {
            reason = "Estimated cost $%.2f would exceed monthly limit".formatted(estimatedCost);
        }
        if (reason != null) {
            log.warn("Budget check denied: {}", reason);
        }

        return new BudgetCheck(reason == null, reason,
                dailySpent, dailyLimit, monthlySpent, monthlyLimit,
                Math.max(0, dailyLimit - dailySpent),
                Math.max(0, monthlyLimit - monthlySpent));
    }

    public BudgetStatus getStatus() {
        double today = counters.spend(UsagePeriod.DAY);
        double month = counters.spend(UsagePeriod.MONTH);
        return new BudgetStatus(today, month,
                budget.dailyLimitUsd(), budget.monthlyLimitUsd(),
                percent(today, budget.dailyLimitUsd()),
                percent(month, budget.monthlyLimitUsd()),
                today >= budget.dailyLimitUsd(),
                month >= budget.monthlyLimitUsd());
    }

    /** min(perJobLimit, dailyRemaining, monthlyRemaining). */
    public double getEffectivePerJobBudget() {
        BudgetCheck check = canProceed();
        return Math.min(budget.perJobLimitUsd(), Math.min(check.dailyRemaining(), check.monthlyRemaining()));
    }

    public boolean isWithinBudget(double cost) {
        return canProceed(cost).allowed();
    }

    public void recordSpend(String projectId, UUID jobId, double amountUsd) {
        counters.recordSpend(projectId, jobId, amountUsd);
    }

    private static double percent(double used, double limit) {
        return limit <= 0 ? 100.0 : used / limit * 100.0;
    }
}
