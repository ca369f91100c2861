package kr.hhplus.be.staking.application.port.out;

import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.payment.WalletReason;

/**
 * 자금 보관(커스터디) 포트
 * - 이체 실패 시 예외를 던지고, 호출한 연산 전체가 취소된다
 */
public interface CustodyPort {

    // 참가자 → 예치 계정
    void collect(ParticipantId from, Money amount, String reference);

    // 예치 계정 → 수령인
    void payout(ParticipantId to, Money amount, WalletReason reason, String reference);

    // 현재 보관 중인 총 예치금
    Money custodiedBalance();
}
