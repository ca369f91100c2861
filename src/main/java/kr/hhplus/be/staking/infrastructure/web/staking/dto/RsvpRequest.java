package kr.hhplus.be.staking.infrastructure.web.staking.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record RsvpRequest(@NotNull @PositiveOrZero Long amount) {}
