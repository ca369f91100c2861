package kr.hhplus.be.staking.infrastructure.web.event.dto;

import jakarta.validation.constraints.NotNull;

// 0 값 검증은 도메인이 오류 종류별로 처리하므로 여기서는 누락만 막는다
public record CreateEventRequest(
        String name,
        @NotNull Long capacity,
        @NotNull Long price,
        @NotNull Long startTime,
        @NotNull Long duration
) {}
