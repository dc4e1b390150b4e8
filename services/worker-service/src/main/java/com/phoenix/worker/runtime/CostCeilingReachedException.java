package com.phoenix.worker.runtime;

public class CostCeilingReachedException extends RuntimeException {

    private final long requestedMicros;
    private final long remainingMicros;

    public CostCeilingReachedException(long requestedMicros, long remainingMicros) {
        super("Cost ceiling reached: requested " + requestedMicros + " micros, " + remainingMicros + " remaining");
        this.requestedMicros = requestedMicros;
        this.remainingMicros = remainingMicros;
    }

    public long getRequestedMicros() {
        return requestedMicros;
    }

    public long getRemainingMicros() {
        return remainingMicros;
    }
}
