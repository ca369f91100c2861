package kr.hhplus.be.staking.domain.exception;

// 최대 참가 인원이 0일 때
public class MissingCapacityException extends StakingException {
    public MissingCapacityException() { super(StakingErrorCode.MISSING_CAPACITY); }
}
