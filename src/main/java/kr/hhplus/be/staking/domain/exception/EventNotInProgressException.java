package kr.hhplus.be.staking.domain.exception;

public class EventNotInProgressException extends StakingException {

    public EventNotInProgressException(long startTime, long endTime, long now) {
        super(StakingErrorCode.EVENT_NOT_IN_PROGRESS,
                String.format("진행 중인 이벤트가 아닙니다. 구간: [%d, %d), 현재: %d", startTime, endTime, now));
    }
}
