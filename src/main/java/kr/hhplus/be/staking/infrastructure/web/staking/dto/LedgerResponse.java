package kr.hhplus.be.staking.infrastructure.web.staking.dto;

public record LedgerResponse(long eventId, long escrowedBalance, long participantCount, long capacity) {}
