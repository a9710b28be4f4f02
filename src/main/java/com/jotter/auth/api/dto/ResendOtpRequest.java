package com.jotter.auth.api.dto;

import jakarta.validation.constraints.NotNull;

public record ResendOtpRequest(
        @NotNull Long userId
) {
}
