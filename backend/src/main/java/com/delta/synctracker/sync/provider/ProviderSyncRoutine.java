package com.delta.synctracker.sync.provider;

/**
 * Pulls data from one external provider. Each implementation is a Spring bean selected by
 * {@link #providerName()} matching a configured provider key.
 *
 * <p>Routines should be idempotent and bounded: a routine that never returns stalls its own
 * provider's worker. Any exception thrown is recorded as a sync failure.
 */
public interface ProviderSyncRoutine {

    String providerName();

    void sync(SyncContext context) throws Exception;
}
