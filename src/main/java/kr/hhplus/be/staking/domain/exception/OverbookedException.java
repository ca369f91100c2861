package kr.hhplus.be.staking.domain.exception;

public class OverbookedException extends StakingException {

    public OverbookedException(long eventId, long capacity) {
        super(StakingErrorCode.OVERBOOKED,
                String.format("정원이 가득 찼습니다. eventId: %d, 정원: %d", eventId, capacity));
    }
}
