package kr.hhplus.be.staking.domain.exception;

// 같은 참가자가 다시 예약을 시도할 때
public class AlreadyReservedException extends StakingException {
    public AlreadyReservedException() { super(StakingErrorCode.ALREADY_RESERVED); }
}
