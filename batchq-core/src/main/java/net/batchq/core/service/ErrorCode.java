package net.batchq.core.service;

public enum ErrorCode {
    ADMISSION_DENIED,   // 사용자/전역 상한 또는 큐 용량 초과
    NOT_FOUND,          // 모르는 task/batch id
    /**
     * 이미 종료된 태스크에 대한 ack/cancel 같은 상태 충돌.
     * 호출자에게 오류로 올리지 않는다: ack 는 false, cancel 은 success(false) (중복 전달 허용)
     */
    INVALID_STATE,
    BATCH_TOO_LARGE,
    INVALID_INPUT
}
