package com.jotter.auth.verification;

import com.jotter.auth.config.AuthProperties;
import com.jotter.user.domain.User;
import com.jotter.user.service.UserService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;

/**
 * 一次性验证码服务。
 * <p>
 * 负责生成与校验 OTP：
 * - 6 位数字，均匀分布于 000000–999999，保留前导零；
 * - 有效期来自 {@code auth.otp.ttl}（默认 10 分钟），过期时间本身视为已过期；
 * - 每个用户只保留一个挑战，新挑战直接覆盖旧挑战；
 * - 只返回验证码，不负责发送；校验不修改存储的挑战，由调用方决定如何清除。
 */
@Service
@RequiredArgsConstructor
public class OtpService {

    static final int CODE_LENGTH = 6;
    private static final int CODE_BOUND = 1_000_000;
    private static final SecureRandom RANDOM = new SecureRandom();

    private final UserService userService;
    private final AuthProperties properties;
    private final Clock clock;

    public OtpChallenge newChallenge() {
        String code = String.format("%0" + CODE_LENGTH + "d", RANDOM.nextInt(CODE_BOUND));
        Instant expiresAt = Instant.now(clock).plus(properties.getOtp().getTtl());
        return new OtpChallenge(code, expiresAt);
    }

    /**
     * 为用户签发新的 OTP 并持久化，返回待投递的验证码。
     */
    public String issue(User user) {
        OtpChallenge challenge = newChallenge();
        userService.saveOtp(user, challenge.code(), challenge.expiresAt());
        return challenge.code();
    }

    public VerificationCodeStatus verify(User user, String suppliedCode) {
        String storedCode = user.getOtpCode();
        Instant expiry = user.getOtpExpiry();
        if (storedCode == null || expiry == null) {
            return VerificationCodeStatus.NOT_FOUND;
        }
        if (!Instant.now(clock).isBefore(expiry)) {
            return VerificationCodeStatus.EXPIRED;
        }
        if (suppliedCode == null || !MessageDigest.isEqual(
                storedCode.getBytes(StandardCharsets.UTF_8), suppliedCode.getBytes(StandardCharsets.UTF_8))) {
            return VerificationCodeStatus.MISMATCH;
        }
        return VerificationCodeStatus.SUCCESS;
    }

    public int expireMinutes() {
        return (int) properties.getOtp().getTtl().toMinutes();
    }
}
