package kr.hhplus.be.staking.application.port.in;

import kr.hhplus.be.staking.domain.staking.RsvpStatus;

/**
 * 예약 원장 조회 - 모든 조회는 실패하지 않는다
 */
public interface StakingQueryUseCase {

    record LedgerView(long eventId, long escrowedBalance, long participantCount, long capacity) {}

    LedgerView getLedger(long eventId);

    RsvpStatus getRsvpStatus(long eventId, String participant);
}
