package com.jotter.user.service;

import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import com.jotter.user.domain.User;
import com.jotter.user.mapper.UserMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * 用户凭据存储。
 * <p>
 * 负责用户记录的读写与密码哈希：
 * - 邮箱统一 trim + 小写后再查询或写入；
 * - 明文密码在写库之前显式转换为 BCrypt 哈希，明文不会进入持久层；
 * - OTP 字段与验证状态通过单条 UPDATE 语句原子写入；
 * - 唯一索引冲突转为 {@link ErrorCode#DUPLICATE_IDENTITY}，其余存储异常转为 {@link ErrorCode#STORE_UNAVAILABLE}。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserService {

    // BCrypt 只读取前 72 个 UTF-8 字节
    static final int MAX_PASSWORD_BYTES = 72;

    private final UserMapper userMapper;
    private final PasswordEncoder passwordEncoder;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Optional<User> findByEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return Optional.empty();
        }
        String normalized = normalizeEmail(email);
        return Optional.ofNullable(access(() -> userMapper.findByEmail(normalized)));
    }

    @Transactional(readOnly = true)
    public Optional<User> findById(long id) {
        return Optional.ofNullable(access(() -> userMapper.findById(id)));
    }

    @Transactional(readOnly = true)
    public boolean existsByEmail(String email) {
        String normalized = normalizeEmail(email);
        return access(() -> userMapper.existsByEmail(normalized));
    }

    /**
     * 创建用户。若提供了明文密码，先哈希再插入。
     *
     * @param user 待创建的用户（id 由数据库回填）
     * @param rawPassword 明文密码，可为空（联合登录账号）
     * @return 已持久化的用户
     */
    @Transactional
    public User create(User user, String rawPassword) {
        user.setEmail(normalizeEmail(user.getEmail()));
        if (StringUtils.hasText(rawPassword)) {
            user.setPasswordHash(hashPassword(rawPassword));
        }
        Instant now = Instant.now(clock);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        try {
            userMapper.insert(user);
        } catch (DuplicateKeyException ex) {
            throw new BusinessException(ErrorCode.DUPLICATE_IDENTITY);
        } catch (DataAccessException ex) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, ex);
        }
        log.info("User created id={} email={} federated={}", user.getId(), user.getEmail(), user.hasFederatedIdentity());
        return user;
    }

    /**
     * 覆盖保存资料与凭据字段。已验证状态不会被回退，OTP 字段不在此处写入。
     */
    @Transactional
    public User save(User user) {
        user.setUpdatedAt(Instant.now(clock));
        access(() -> userMapper.update(user));
        return user;
    }

    /**
     * 写入新的 OTP 挑战，覆盖任何尚未使用的旧挑战。
     */
    @Transactional
    public void saveOtp(User user, String otpCode, Instant otpExpiry) {
        access(() -> userMapper.updateOtp(user.getId(), otpCode, otpExpiry));
        user.setOtpCode(otpCode);
        user.setOtpExpiry(otpExpiry);
    }

    /**
     * 标记已验证并清除 OTP，条件是存储中的 OTP 仍为 {@code otpCode}。
     *
     * @return false 表示该挑战已被新的挑战覆盖或已被并发请求消费
     */
    @Transactional
    public boolean completeVerification(User user, String otpCode) {
        Instant now = Instant.now(clock);
        int updated = access(() -> userMapper.completeVerification(user.getId(), otpCode, now));
        if (updated == 0) {
            return false;
        }
        user.setVerified(true);
        user.clearOtp();
        user.setUpdatedAt(now);
        return true;
    }

    @Transactional
    public User changePassword(User user, String rawPassword) {
        String hash = hashPassword(rawPassword);
        Instant now = Instant.now(clock);
        access(() -> userMapper.updatePassword(user.getId(), hash, now));
        user.setPasswordHash(hash);
        user.setUpdatedAt(now);
        return user;
    }

    /**
     * 校验明文密码。账号没有密码哈希，或明文超过 BCrypt 可读长度时一律返回 false。
     */
    public boolean comparePassword(User user, String rawPassword) {
        if (user == null || !user.hasPassword() || rawPassword == null || exceedsBcryptLimit(rawPassword)) {
            return false;
        }
        return passwordEncoder.matches(rawPassword, user.getPasswordHash());
    }

    public static String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private String hashPassword(String rawPassword) {
        if (!StringUtils.hasText(rawPassword)) {
            throw new BusinessException(ErrorCode.VALIDATION_FAILED, "Password is required");
        }
        if (exceedsBcryptLimit(rawPassword)) {
            throw new BusinessException(ErrorCode.VALIDATION_FAILED,
                    "Password must not exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return passwordEncoder.encode(rawPassword);
    }

    private static boolean exceedsBcryptLimit(String rawPassword) {
        return rawPassword.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }

    private static <T> T access(Supplier<T> operation) {
        try {
            return operation.get();
        } catch (DataAccessException ex) {
            throw new BusinessException(ErrorCode.STORE_UNAVAILABLE, ex);
        }
    }
}
