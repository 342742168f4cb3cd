package com.patchpilot.orchestrator.engine;

public record ProcessedJob(String url, boolean success, String artifactUrl, String error) {}
