package kr.hhplus.be.staking.application.port.in;

public interface StakingUseCase {

    // 예약 (참가비 예치)
    record ReserveCommand(long eventId, String participant, long amount) {}
    record ReserveResult(long eventId, String participant, long stakedAmount, long escrowedBalance) {}

    // 현장 체크인 (예치금 환급)
    record CheckInCommand(long eventId, String participant) {}
    record CheckInResult(long eventId, String participant, long refundedAmount) {}

    // 주최자 정산 (노쇼 예치금 인출)
    record WithdrawCommand(long eventId, String caller) {}
    record WithdrawResult(long eventId, long amount) {}

    ReserveResult reserve(ReserveCommand command);

    CheckInResult checkIn(CheckInCommand command);

    WithdrawResult withdrawProceeds(WithdrawCommand command);
}
