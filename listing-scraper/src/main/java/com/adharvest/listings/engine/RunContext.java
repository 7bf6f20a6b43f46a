package com.adharvest.listings.engine;

import com.adharvest.listings.error.RunAbortedException;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of a single run: fingerprints, statistics and cancellation.
 * Created at run start, passed through every engine call, dropped at run end.
 */
@Slf4j
public class RunContext {

    private final String runId;
    private final FingerprintStore fingerprints = new FingerprintStore();
    private final RunStats stats = new RunStats();
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final List<Runnable> cancelHooks = new CopyOnWriteArrayList<>();
    private volatile String abortReason;

    public RunContext(String runId) {
        this.runId = runId;
    }

    public static RunContext create() {
        return new RunContext(UUID.randomUUID().toString());
    }

    public String runId() {
        return runId;
    }

    public FingerprintStore fingerprints() {
        return fingerprints;
    }

    public RunStats stats() {
        return stats;
    }

    /**
     * Requests the run to stop. Only the first call wins; later reasons are ignored.
     *
     * @return true if this call cancelled the run
     */
    public boolean cancel(String reason) {
        if (!cancelled.compareAndSet(false, true)) {
            return false;
        }
        abortReason = reason;
        log.warn("Run {} cancelled: {}", runId, reason);
        for (Runnable hook : cancelHooks) {
            hook.run();
        }
        return true;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public String abortReason() {
        return abortReason;
    }

    public void checkNotCancelled() {
        if (cancelled.get()) {
            throw new RunAbortedException(abortReason);
        }
    }

    /**
     * Counts an error and aborts the run when the count reaches {@code threshold} (0 disables).
     */
    void recordError(int threshold) {
        long errors = stats.errorRecorded();
        if (threshold > 0 && errors >= threshold) {
            cancel("error threshold reached (" + errors + " errors)");
        }
    }

    void onCancel(Runnable hook) {
        cancelHooks.add(hook);
        if (cancelled.get()) {
            hook.run();
        }
    }
}
