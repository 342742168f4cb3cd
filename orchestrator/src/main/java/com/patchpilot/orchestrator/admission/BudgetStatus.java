package com.patchpilot.orchestrator.admission;

public record BudgetStatus(
        double  todaysCost,
        double  monthsCost,
        double  dailyLimit,
        double  monthlyLimit,
        double  dailyPercentUsed,
        double  monthlyPercentUsed,
        boolean dailyExceeded,
        boolean monthlyExceeded
) {}
