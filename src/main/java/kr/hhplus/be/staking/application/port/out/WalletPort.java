package kr.hhplus.be.staking.application.port.out;

import kr.hhplus.be.staking.domain.payment.Wallet;
import kr.hhplus.be.staking.domain.payment.WalletLedgerEntry;

import java.util.List;
import java.util.Optional;

/**
 * 지갑 관련 외부 포트 인터페이스
 * - 순수 데이터 접근만 담당
 */
public interface WalletPort {

    // 조회
    Optional<Wallet> findById(String walletId);

    // 없으면 잔액 0으로 생성
    Wallet getOrCreate(String walletId);

    // 원장 기록
    void saveLedgerEntry(WalletLedgerEntry entry);

    List<WalletLedgerEntry> ledgerOf(String walletId);
}
