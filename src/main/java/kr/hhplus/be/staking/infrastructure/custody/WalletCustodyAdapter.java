package kr.hhplus.be.staking.infrastructure.custody;

import kr.hhplus.be.staking.application.port.out.CustodyPort;
import kr.hhplus.be.staking.application.port.out.WalletPort;
import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.payment.InsufficientBalanceException;
import kr.hhplus.be.staking.domain.payment.Wallet;
import kr.hhplus.be.staking.domain.payment.WalletLedgerEntry;
import kr.hhplus.be.staking.domain.payment.WalletReason;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 지갑 기반 커스터디
 * - 참가자 지갑과 예치 계정 지갑 사이의 이체로 자금 이동을 표현
 * - 이체는 전부 반영되거나 전혀 반영되지 않는다
 */
@Slf4j
@Component
public class WalletCustodyAdapter implements CustodyPort {

    private final WalletPort wallets;
    private final Clock clock;

    public WalletCustodyAdapter(WalletPort wallets, Clock clock) {
        this.wallets = wallets;
        this.clock = clock;
    }

    @Override
    public void collect(ParticipantId from, Money amount, String reference) {
        requireParticipantWallet(from);

        Wallet source = wallets.findById(from.value())
                .orElseThrow(() -> InsufficientBalanceException.of(from.value(), amount.amount(), 0L));
        transfer(source, escrowWallet(), amount, WalletReason.STAKE, reference);
        log.debug("[Custody] 예치 수령 - from: {}, amount: {}, ref: {}", from, amount, reference);
    }

    @Override
    public void payout(ParticipantId to, Money amount, WalletReason reason, String reference) {
        requireParticipantWallet(to);

        transfer(escrowWallet(), wallets.getOrCreate(to.value()), amount, reason, reference);
        log.debug("[Custody] 지급 - to: {}, amount: {}, reason: {}, ref: {}", to, amount, reason, reference);
    }

    @Override
    public Money custodiedBalance() {
        return wallets.findById(Wallet.ESCROW_WALLET_ID)
                .map(Wallet::getBalance)
                .orElse(Money.zero());
    }

    private Wallet escrowWallet() {
        return wallets.getOrCreate(Wallet.ESCROW_WALLET_ID);
    }

    /**
     * 출금 → 입금 순서로 이체
     * 입금이 거절되면 출금을 되돌린 뒤 예외를 그대로 던진다 (양쪽 잔액 모두 이체 전 상태)
     */
    private void transfer(Wallet from, Wallet to, Money amount, WalletReason reason, String reference) {
        from.withdraw(amount);
        try {
            to.deposit(amount);
        } catch (RuntimeException e) {
            from.deposit(amount);
            log.warn("[Custody] 입금 거절로 이체 취소 - from: {}, to: {}, amount: {}, error: {}",
                    from.getId(), to.getId(), amount, e.getMessage());
            throw e;
        }

        record(from, -amount.amount(), reason, reference);
        record(to, amount.amount(), reason, reference);
    }

    private void record(Wallet wallet, long amount, WalletReason reason, String reference) {
        wallets.saveLedgerEntry(new WalletLedgerEntry(wallet.getId(), amount, reason, reference, Instant.now(clock)));
    }

    private static void requireParticipantWallet(ParticipantId participant) {
        if (Wallet.isReservedId(participant.value())) {
            throw new IllegalArgumentException("예치 계정은 참가자로 사용할 수 없습니다");
        }
    }
}
