package com.patchpilot.orchestrator.queue;

public record QueueStatus(int size, boolean needsReplenishment, int minQueueSize, int targetQueueSize) {}
