package kr.hhplus.be.staking.domain.exception;

public class ReservationNotFoundException extends StakingException {

    public ReservationNotFoundException(long eventId, String participant) {
        super(StakingErrorCode.RESERVATION_NOT_FOUND,
                String.format("예약 내역이 없습니다. eventId: %d, participant: %s", eventId, participant));
    }
}
