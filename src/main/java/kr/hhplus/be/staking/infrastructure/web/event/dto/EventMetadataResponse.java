package kr.hhplus.be.staking.infrastructure.web.event.dto;

public record EventMetadataResponse(String name, String owner) {}
