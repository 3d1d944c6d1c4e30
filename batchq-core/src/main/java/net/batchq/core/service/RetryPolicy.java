package net.batchq.core.service;

/** lease 만료 시 재큐잉 허용 여부 */
public interface RetryPolicy {
    /** @param retryCount 지금까지 재큐잉된 횟수 */
    boolean allowsRequeue(int retryCount);

    /** 횟수 제한 없음 (기본) */
    static RetryPolicy unbounded() {
        return retryCount -> true;
    }

    /** n 번까지만 재큐잉, 그 다음 만료는 FAILED */
    static RetryPolicy maxRequeues(int n) {
        return new MaxRequeuePolicy(n);
    }
}
