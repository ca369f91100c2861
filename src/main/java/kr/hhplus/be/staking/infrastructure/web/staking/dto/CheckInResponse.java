package kr.hhplus.be.staking.infrastructure.web.staking.dto;

public record CheckInResponse(long eventId, String participant, long refundedAmount) {}
