package kr.hhplus.be.staking.infrastructure.web.wallet.dto;

public record WalletBalanceResponse(String participantId, long balance) {}
