package kr.hhplus.be.staking.infrastructure.web.event.dto;

public record CreateEventResponse(long eventId) {}
