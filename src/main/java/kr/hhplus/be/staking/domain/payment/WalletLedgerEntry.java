package kr.hhplus.be.staking.domain.payment;

import java.time.Instant;

/**
 * 지갑 원장 한 줄 - 입금은 양수, 출금은 음수
 */
public record WalletLedgerEntry(
        String walletId,
        long amount,
        WalletReason reason,
        String reference,
        Instant createdAt
) {}
