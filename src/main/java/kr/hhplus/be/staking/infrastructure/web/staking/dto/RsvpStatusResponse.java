package kr.hhplus.be.staking.infrastructure.web.staking.dto;

public record RsvpStatusResponse(long eventId, String participant, String status) {}
