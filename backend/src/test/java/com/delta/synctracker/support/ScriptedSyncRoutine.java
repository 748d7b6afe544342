package com.delta.synctracker.support;

import com.delta.synctracker.sync.provider.ProviderSyncRoutine;
import com.delta.synctracker.sync.provider.SyncContext;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/** Routine whose behaviour a test can script: succeed, throw, or block until released. */
public class ScriptedSyncRoutine implements ProviderSyncRoutine {
    private final String providerName;
    private final AtomicInteger invocations = new AtomicInteger();
    private volatile RuntimeException failure;
    private volatile Error error;
    private volatile CountDownLatch entered;
    private volatile CountDownLatch release;

    public ScriptedSyncRoutine(String providerName) {
        this.providerName = providerName;
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public void sync(SyncContext context) throws Exception {
        invocations.incrementAndGet();
        CountDownLatch gate = release;
        if (gate != null) {
            entered.countDown();
            if (!gate.await(5, TimeUnit.SECONDS)) {
                throw new IllegalStateException("scripted routine was never released");
            }
        }
        RuntimeException scripted = failure;
        if (scripted != null) {
            throw scripted;
        }
        Error scriptedError = error;
        if (scriptedError != null) {
            throw scriptedError;
        }
    }

    public void failWith(RuntimeException failure) {
        this.failure = failure;
    }

    public void failWithError(Error error) {
        this.error = error;
    }

    public void succeed() {
        this.failure = null;
        this.error = null;
    }

    /** Makes the next invocations block until {@link #release()} is called. */
    public CountDownLatch blockUntilReleased() {
        this.entered = new CountDownLatch(1);
        this.release = new CountDownLatch(1);
        return entered;
    }

    public void release() {
        CountDownLatch gate = release;
        release = null;
        if (gate != null) {
            gate.countDown();
        }
    }

    public int invocations() {
        return invocations.get();
    }

    public void reset() {
        invocations.set(0);
        failure = null;
        error = null;
        release();
    }
}
