package webscan.http;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-scan cancellation flag and request budget shared by every executor of one scan.
 * A budget of zero or less means unlimited.
 */
public final class ExecutionControl {
    private final long maxRequests;
    private final AtomicLong issued = new AtomicLong();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public ExecutionControl(long maxRequests) {
        this.maxRequests = maxRequests;
    }

    public static ExecutionControl unlimited() {
        return new ExecutionControl(0);
    }

    /**
     * Reserves one request from the budget.
     *
     * @return false if the scan is cancelled or the budget is exhausted
     */
    public boolean tryAcquire() {
        if (cancelled.get()) {
            return false;
        }
        if (maxRequests <= 0) {
            issued.incrementAndGet();
            return true;
        }
        long current;
        do {
            current = issued.get();
            if (current >= maxRequests) {
                return false;
            }
        } while (!issued.compareAndSet(current, current + 1));
        return true;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public boolean isBudgetExhausted() {
        return maxRequests > 0 && issued.get() >= maxRequests;
    }

    public long getIssued() {
        return issued.get();
    }

    public long getMaxRequests() {
        return maxRequests;
    }
}
