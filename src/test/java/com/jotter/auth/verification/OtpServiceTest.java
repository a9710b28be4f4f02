package com.jotter.auth.verification;

import com.jotter.auth.config.AuthProperties;
import com.jotter.support.InMemoryUserMapper;
import com.jotter.support.MutableClock;
import com.jotter.user.domain.User;
import com.jotter.user.service.UserService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class OtpServiceTest {

    private static final Instant START = Instant.parse("2026-03-01T08:00:00Z");

    private InMemoryUserMapper userMapper;
    private MutableClock clock;
    private OtpService otpService;
    private User user;

    @BeforeEach
    void setUp() {
        userMapper = new InMemoryUserMapper();
        clock = new MutableClock(START);
        UserService userService = new UserService(userMapper, new BCryptPasswordEncoder(4), clock);
        otpService = new OtpService(userService, new AuthProperties(), clock);
        user = userService.create(User.builder().email("ann@example.com").name("Ann").build(), "secret1");
    }

    @Test
    void codesAreExactlySixDigits() {
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 500; i++) {
            String code = otpService.newChallenge().code();
            assertThat(code).hasSize(OtpService.CODE_LENGTH).containsOnlyDigits();
            seen.add(code);
        }
        assertThat(seen.size()).isGreaterThan(450);
    }

    @Test
    void issuePersistsCodeWithTenMinuteExpiry() {
        String code = otpService.issue(user);

        User stored = userMapper.row(user.getId());
        assertThat(stored.getOtpCode()).isEqualTo(code);
        assertThat(stored.getOtpExpiry()).isEqualTo(START.plus(Duration.ofMinutes(10)));
        assertThat(otpService.expireMinutes()).isEqualTo(10);
    }

    @Test
    void verifySucceedsForMatchingUnexpiredCode() {
        String code = otpService.issue(user);
        clock.advance(Duration.ofMinutes(9).plusSeconds(59));

        assertThat(otpService.verify(userMapper.row(user.getId()), code)).isEqualTo(VerificationCodeStatus.SUCCESS);
    }

    @Test
    void verifyAtExactExpiryIsExpired() {
        String code = otpService.issue(user);
        clock.set(START.plus(Duration.ofMinutes(10)));

        assertThat(otpService.verify(userMapper.row(user.getId()), code)).isEqualTo(VerificationCodeStatus.EXPIRED);
    }

    @Test
    void verifyAfterExpiryIsExpired() {
        String code = otpService.issue(user);
        clock.advance(Duration.ofHours(1));

        assertThat(otpService.verify(userMapper.row(user.getId()), code)).isEqualTo(VerificationCodeStatus.EXPIRED);
    }

    @Test
    void verifyWithDifferentCodeIsMismatchAndLeavesChallenge() {
        String code = otpService.issue(user);
        String wrong = code.equals("000000") ? "000001" : "000000";

        assertThat(otpService.verify(userMapper.row(user.getId()), wrong)).isEqualTo(VerificationCodeStatus.MISMATCH);
        assertThat(otpService.verify(userMapper.row(user.getId()), null)).isEqualTo(VerificationCodeStatus.MISMATCH);

        User stored = userMapper.row(user.getId());
        assertThat(stored.getOtpCode()).isEqualTo(code);
        assertThat(otpService.verify(stored, code)).isEqualTo(VerificationCodeStatus.SUCCESS);
    }

    @Test
    void verifyWithoutOutstandingChallengeIsNotFound() {
        assertThat(otpService.verify(userMapper.row(user.getId()), "123456")).isEqualTo(VerificationCodeStatus.NOT_FOUND);
    }

    @Test
    void reissuingInvalidatesPreviousCode() {
        String first = otpService.issue(user);
        String second = otpService.issue(user);
        while (second.equals(first)) {
            second = otpService.issue(user);
        }

        User stored = userMapper.row(user.getId());
        assertThat(otpService.verify(stored, first)).isEqualTo(VerificationCodeStatus.MISMATCH);
        assertThat(otpService.verify(stored, second)).isEqualTo(VerificationCodeStatus.SUCCESS);
    }

    @Test
    void verifyComparesCodesExactly() {
        userMapper.updateOtp(user.getId(), "012345", START.plus(Duration.ofMinutes(10)));
        User stored = userMapper.row(user.getId());

        assertThat(otpService.verify(stored, "12345")).isEqualTo(VerificationCodeStatus.MISMATCH);
        assertThat(otpService.verify(stored, " 012345")).isEqualTo(VerificationCodeStatus.MISMATCH);
        assertThat(otpService.verify(stored, "012345")).isEqualTo(VerificationCodeStatus.SUCCESS);
    }
}
