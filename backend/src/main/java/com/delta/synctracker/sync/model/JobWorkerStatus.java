package com.delta.synctracker.sync.model;

import java.util.List;

public record JobWorkerStatus(
    boolean running,
    List<String> handledJobTypes,
    long completedCount,
    long failedCount
) {
}
