package com.patchpilot.orchestrator.api.dto;

/** Identifies a backlog entry by issue URL. */
public record QueueItemRequest(String url) {}
