package com.delta.synctracker.sync.api;

public record DisableIntegrationRequest(String reason, String actor) {
}
