package kr.hhplus.be.staking.domain.exception;

// 남은 예치금이 없을 때
public class NothingToWithdrawException extends StakingException {
    public NothingToWithdrawException() { super(StakingErrorCode.NOTHING_TO_WITHDRAW); }
}
