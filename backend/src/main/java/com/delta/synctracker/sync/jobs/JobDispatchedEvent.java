package com.delta.synctracker.sync.jobs;

import java.util.UUID;

public record JobDispatchedEvent(UUID jobId, String jobType) {
}
