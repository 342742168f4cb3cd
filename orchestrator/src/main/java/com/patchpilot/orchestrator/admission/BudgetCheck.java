package com.patchpilot.orchestrator.admission;

public record BudgetCheck(
        boolean allowed,
        String  reason,
        double  dailySpent,
        double  dailyLimit,
        double  monthlySpent,
        double  monthlyLimit,
        double  dailyRemaining,
        double  monthlyRemaining
) {}
