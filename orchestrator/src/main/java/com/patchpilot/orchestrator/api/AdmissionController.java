package com.patchpilot.orchestrator.api;

import com.patchpilot.orchestrator.admission.BudgetManager;
import com.patchpilot.orchestrator.admission.RateLimiter;
import com.patchpilot.orchestrator.api.dto.AdmissionResponse;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * GET /admission?projectId=acme/api   rate and budget gates as they stand now.
 * Without projectId the rate check covers the global daily cap only.
 */
@RestController
public class AdmissionController {

    private final RateLimiter   rateLimiter;
    private final BudgetManager budget;

    public AdmissionController(RateLimiter rateLimiter, BudgetManager budget) {
        this.rateLimiter = rateLimiter;
        this.budget      = budget;
    }

    @GetMapping("/admission")
    public AdmissionResponse admission(@RequestParam(required = false) String projectId) {
        return new AdmissionResponse(
                projectId == null ? rateLimiter.canCreateAnyPR() : rateLimiter.canCreatePR(projectId),
                rateLimiter.getRemainingCapacity(projectId),
                budget.canProceed(),
                budget.getStatus(),
                budget.getEffectivePerJobBudget());
    }
}
