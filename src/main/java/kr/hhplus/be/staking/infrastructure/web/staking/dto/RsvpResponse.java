package kr.hhplus.be.staking.infrastructure.web.staking.dto;

public record RsvpResponse(long eventId, String participant, long stakedAmount, long escrowedBalance) {}
