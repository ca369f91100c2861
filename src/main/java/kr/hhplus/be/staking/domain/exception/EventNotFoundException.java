package kr.hhplus.be.staking.domain.exception;

public class EventNotFoundException extends StakingException {

    public EventNotFoundException(long eventId) {
        super(StakingErrorCode.EVENT_NOT_FOUND,
                String.format("이벤트를 찾을 수 없습니다. eventId: %d", eventId));
    }
}
