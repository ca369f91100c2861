package kr.hhplus.be.staking.application.service;

import kr.hhplus.be.staking.application.port.in.WalletUseCase;
import kr.hhplus.be.staking.application.port.out.CustodyPort;
import kr.hhplus.be.staking.application.port.out.WalletPort;
import kr.hhplus.be.staking.domain.common.Money;
import kr.hhplus.be.staking.domain.common.ParticipantId;
import kr.hhplus.be.staking.domain.payment.Wallet;
import kr.hhplus.be.staking.domain.payment.WalletLedgerEntry;
import kr.hhplus.be.staking.domain.payment.WalletReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class WalletService implements WalletUseCase {

    private final WalletPort wallets;
    private final CustodyPort custody;
    private final Clock clock;

    /**
     * 지갑 충전 - 지갑이 없으면 새로 생성
     */
    @Override
    public ChargeResult charge(ChargeCommand command) {
        ParticipantId participant = ParticipantId.of(command.participant());
        if (Wallet.isReservedId(participant.value())) {
            throw new IllegalArgumentException("예치 계정은 직접 충전할 수 없습니다");
        }

        Wallet wallet = wallets.getOrCreate(participant.value());
        wallet.deposit(Money.of(command.amount()));
        wallets.saveLedgerEntry(new WalletLedgerEntry(
                wallet.getId(), command.amount(), WalletReason.CHARGE, null, Instant.now(clock)));

        long balance = wallet.getBalance().amount();
        log.info("[Wallet] 충전 완료 - participant: {}, amount: {}, balance: {}",
                participant, command.amount(), balance);
        return new ChargeResult(participant.value(), balance);
    }

    @Override
    public long balanceOf(String participant) {
        return wallets.findById(ParticipantId.of(participant).value())
                .map(wallet -> wallet.getBalance().amount())
                .orElse(0L);
    }

    @Override
    public long escrowBalance() {
        return custody.custodiedBalance().amount();
    }
}
