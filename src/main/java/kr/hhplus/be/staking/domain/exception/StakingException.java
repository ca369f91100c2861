package kr.hhplus.be.staking.domain.exception;

/**
 * 스테이킹 도메인 예외의 공통 부모
 * - 실패한 연산은 어떤 상태도 변경하지 않은 채로 이 예외를 던진다
 */
public abstract class StakingException extends RuntimeException {

    private final StakingErrorCode errorCode;

    protected StakingException(StakingErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected StakingException(StakingErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public StakingErrorCode getErrorCode() {
        return errorCode;
    }

    public ErrorCategory getCategory() {
        return errorCode.getCategory();
    }
}
