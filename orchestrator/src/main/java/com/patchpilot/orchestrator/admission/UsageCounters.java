package com.patchpilot.orchestrator.admission;

import com.patchpilot.orchestrator.config.PatchPilotProperties;
import com.patchpilot.orchestrator.model.UsageEntry;
import com.patchpilot.orchestrator.model.UsageKind;
import com.patchpilot.orchestrator.repository.UsageEntryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.ZoneId;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * PR and spend counters per period, backed by the usage ledger.
 *
 * Totals are sums over the current period's window, read through the injected
 * clock: a new day or month starts from zero without anything being reset.
 */
@Service
public class UsageCounters {

    private final UsageEntryRepository ledger;
    private final Clock                clock;
    private final ZoneId               zone;

    public UsageCounters(UsageEntryRepository ledger, Clock clock, PatchPilotProperties props) {
        this.ledger = ledger;
        this.clock  = clock;
        this.zone   = props.usage().zoneId();
    }

    // ------------------------------------------------------------------
    // Recording
    // ------------------------------------------------------------------

    @Transactional
    public void recordPrCreated(String projectId, UUID jobId) {
        ledger.save(new UsageEntry(UsageKind.PR_CREATED, projectId, jobId, 0.0, clock.instant()));
    }

    @Transactional
    public void recordSpend(String projectId, UUID jobId, double amountUsd) {
        if (amountUsd <= 0) {
            return;
        }
        ledger.save(new UsageEntry(UsageKind.SPEND, projectId, jobId, amountUsd, clock.instant()));
    }

    // ------------------------------------------------------------------
    // Reading
    // ------------------------------------------------------------------

    @Transactional(readOnly = true)
    public long prsCreated(UsagePeriod period) {
        UsagePeriod.Window w = window(period);
        return ledger.countInWindow(UsageKind.PR_CREATED, w.start(), w.end());
    }

    @Transactional(readOnly = true)
    public long prsCreated(UsagePeriod period, String projectId) {
        UsagePeriod.Window w = window(period);
        return ledger.countInWindowForProject(UsageKind.PR_CREATED, projectId, w.start(), w.end());
    }

    @Transactional(readOnly = true)
    public Map<String, Long> prsCreatedByProject(UsagePeriod period) {
        UsagePeriod.Window w = window(period);
        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : ledger.countByProjectInWindow(UsageKind.PR_CREATED, w.start(), w.end())) {
            if (row[0] != null) {
                counts.put((String) row[0], ((Number) row[1]).longValue());
            }
        }
        return counts;
    }

    @Transactional(readOnly = true)
    public double spend(UsagePeriod period) {
        UsagePeriod.Window w = window(period);
        return ledger.sumInWindow(UsageKind.SPEND, w.start(), w.end());
    }

    public UsagePeriod.Window window(UsagePeriod period) {
        return period.windowAt(clock.instant(), zone);
    }
}
