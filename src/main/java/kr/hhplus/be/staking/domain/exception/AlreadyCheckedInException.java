package kr.hhplus.be.staking.domain.exception;

// 체크인을 마친 참가자가 다시 예약/체크인할 때
public class AlreadyCheckedInException extends StakingException {
    public AlreadyCheckedInException() { super(StakingErrorCode.ALREADY_CHECKED_IN); }
}
