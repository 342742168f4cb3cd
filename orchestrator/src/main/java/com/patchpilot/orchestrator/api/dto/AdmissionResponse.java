package com.patchpilot.orchestrator.api.dto;

import com.patchpilot.orchestrator.admission.BudgetCheck;
import com.patchpilot.orchestrator.admission.BudgetStatus;
import com.patchpilot.orchestrator.admission.RateLimitStatus;
import com.patchpilot.orchestrator.admission.RateLimiter;

/** Response body for GET /admission: both gates as they stand right now. */
public record AdmissionResponse(
        RateLimitStatus               rate,
        RateLimiter.RemainingCapacity remaining,
        BudgetCheck                   budgetCheck,
        BudgetStatus                  budget,
        double                        effectivePerJobBudgetUsd
) {}
