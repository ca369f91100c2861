package kr.hhplus.be.staking.domain.exception;

// 참가비가 0일 때
public class MissingPriceException extends StakingException {
    public MissingPriceException() { super(StakingErrorCode.MISSING_PRICE); }
}
