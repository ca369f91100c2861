package kr.hhplus.be.staking.domain.exception;

// 시작 시간이 주어지지 않았을 때
public class MissingStartTimeException extends StakingException {
    public MissingStartTimeException() { super(StakingErrorCode.MISSING_START_TIME); }
}
