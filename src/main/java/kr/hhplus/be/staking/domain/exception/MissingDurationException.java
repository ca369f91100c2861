package kr.hhplus.be.staking.domain.exception;

// 진행 시간이 주어지지 않았을 때
public class MissingDurationException extends StakingException {
    public MissingDurationException() { super(StakingErrorCode.MISSING_DURATION); }
}
