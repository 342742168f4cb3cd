package com.patchpilot.orchestrator.model;

public enum UsageKind {
    PR_CREATED,
    SPEND
}
