package com.coinchase.worker;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Countdown of consecutive outbound write failures a session may absorb;
 * the failure after the last allowed one exhausts it.
 * A successful write restores the full budget.
 */
public class FaultBudget {

    private final int limit;
    private final AtomicInteger remaining;

    public FaultBudget(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("fault tolerance must be positive: " + limit);
        }
        this.limit = limit;
        this.remaining = new AtomicInteger(limit);
    }

    /**
     * @return failures still allowed; negative once the budget is exceeded
     */
    public int recordFailure() {
        return remaining.decrementAndGet();
    }

    public void reset() {
        remaining.set(limit);
    }

    public int getRemaining() {
        return remaining.get();
    }
}
