package com.jotter.auth.api.dto;

import java.time.Instant;

public record AuthResponse(
        String token,
        Instant expiresAt,
        AuthUserResponse user
) {
}
