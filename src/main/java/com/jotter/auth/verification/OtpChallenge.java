package com.jotter.auth.verification;

import java.time.Instant;

/**
 * 一次性验证码挑战：6 位数字码及其过期时间（不含）。
 */
public record OtpChallenge(String code, Instant expiresAt) {
}
