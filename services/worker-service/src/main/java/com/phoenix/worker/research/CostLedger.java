package com.phoenix.worker.research;

import com.phoenix.worker.runtime.CostCeilingReachedException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Running cost of one workflow instance. A charge that would exceed the ceiling is refused
 * before the paid call is made, so the total never goes past the ceiling.
 */
public class CostLedger {

    private final long ceilingMicros;
    private final AtomicLong spentMicros = new AtomicLong();
    private volatile boolean ceilingReached;

    public CostLedger(long ceilingMicros) {
        if (ceilingMicros < 0) {
            throw new IllegalArgumentException("ceilingMicros must not be negative");
        }
        this.ceilingMicros = ceilingMicros;
    }

    public void charge(long micros) {
        if (micros < 0) {
            throw new IllegalArgumentException("micros must not be negative");
        }
        while (true) {
            long current = spentMicros.get();
            if (current + micros > ceilingMicros) {
                ceilingReached = true;
                throw new CostCeilingReachedException(micros, ceilingMicros - current);
            }
            if (spentMicros.compareAndSet(current, current + micros)) {
                return;
            }
        }
    }

    public long spent() {
        return spentMicros.get();
    }

    public long remaining() {
        return ceilingMicros - spentMicros.get();
    }

    public long ceiling() {
        return ceilingMicros;
    }

    /**
     * @return true once any charge has been refused
     */
    public boolean isCeilingReached() {
        return ceilingReached;
    }
}
