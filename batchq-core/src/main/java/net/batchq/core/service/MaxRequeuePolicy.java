package net.batchq.core.service;

final class MaxRequeuePolicy implements RetryPolicy {
    private final int maxRequeues;

    MaxRequeuePolicy(int maxRequeues) {
        if (maxRequeues < 0) throw new IllegalArgumentException("maxRequeues must be >= 0: " + maxRequeues);
        this.maxRequeues = maxRequeues;
    }

    @Override public boolean allowsRequeue(int retryCount) { return retryCount < maxRequeues; }

    @Override public String toString() { return "MaxRequeuePolicy{" + maxRequeues + '}'; }
}
