package kr.hhplus.be.staking.infrastructure.lock;

/**
 * 이벤트 락 획득 실패 시 발생하는 예외
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }

    public static LockAcquisitionException of(long eventId, long waitMillis) {
        return new LockAcquisitionException(
                String.format("락 획득 실패: eventId = %d, 대기 시간 %dms 초과", eventId, waitMillis)
        );
    }
}
