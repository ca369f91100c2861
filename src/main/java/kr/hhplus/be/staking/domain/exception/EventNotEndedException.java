package kr.hhplus.be.staking.domain.exception;

public class EventNotEndedException extends StakingException {

    public EventNotEndedException(long endTime, long now) {
        super(StakingErrorCode.EVENT_NOT_ENDED,
                String.format("아직 종료되지 않은 이벤트입니다. 종료: %d, 현재: %d", endTime, now));
    }
}
