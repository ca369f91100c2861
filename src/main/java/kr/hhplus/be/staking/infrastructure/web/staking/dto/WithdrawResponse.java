package kr.hhplus.be.staking.infrastructure.web.staking.dto;

public record WithdrawResponse(long eventId, long amount) {}
