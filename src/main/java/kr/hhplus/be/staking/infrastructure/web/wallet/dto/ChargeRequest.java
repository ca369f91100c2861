package kr.hhplus.be.staking.infrastructure.web.wallet.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record ChargeRequest(
        @NotBlank String participantId,
        @NotNull @Positive Long amount
) {}
