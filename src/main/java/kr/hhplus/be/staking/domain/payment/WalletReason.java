package kr.hhplus.be.staking.domain.payment;

/**
 * 지갑 원장 기록 사유
 */
public enum WalletReason {
    CHARGE,    // 충전
    STAKE,     // 예약 예치 (참가자 → 예치 계정)
    REFUND,    // 체크인 환급 (예치 계정 → 참가자)
    PROCEEDS   // 노쇼 예치금 정산 (예치 계정 → 주최자)
}
