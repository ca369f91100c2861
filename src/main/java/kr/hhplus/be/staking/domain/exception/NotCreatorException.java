package kr.hhplus.be.staking.domain.exception;

public class NotCreatorException extends StakingException {

    public NotCreatorException(long eventId, String caller) {
        super(StakingErrorCode.NOT_CREATOR,
                String.format("이벤트 주최자만 정산할 수 있습니다. eventId: %d, caller: %s", eventId, caller));
    }
}
