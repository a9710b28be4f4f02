package com.jotter.auth.token;

import java.time.Instant;

public record SessionToken(
        String token,
        Instant issuedAt,
        Instant expiresAt
) {
}
