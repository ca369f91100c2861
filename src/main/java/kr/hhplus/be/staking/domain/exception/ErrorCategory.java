package kr.hhplus.be.staking.domain.exception;

/**
 * 스테이킹 오류 분류
 * 모두 동기적인 검증 실패이며 재시도로 해결되는 일시적 오류는 없다
 */
public enum ErrorCategory {
    NOT_FOUND,
    VALIDATION,
    STATE_CONFLICT,
    TIME_WINDOW,
    AUTHORIZATION,
    ACCOUNTING
}
