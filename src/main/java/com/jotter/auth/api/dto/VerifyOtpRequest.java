package com.jotter.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record VerifyOtpRequest(
        @NotNull Long userId,
        @NotBlank String otp
) {
}
