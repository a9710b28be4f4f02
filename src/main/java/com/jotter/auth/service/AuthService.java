package com.jotter.auth.service;

import com.jotter.auth.api.dto.AuthResponse;
import com.jotter.auth.api.dto.AuthUserResponse;
import com.jotter.auth.api.dto.ChangePasswordRequest;
import com.jotter.auth.api.dto.GoogleAuthRequest;
import com.jotter.auth.api.dto.OtpDispatchResponse;
import com.jotter.auth.api.dto.ResendOtpRequest;
import com.jotter.auth.api.dto.SigninRequest;
import com.jotter.auth.api.dto.SignupRequest;
import com.jotter.auth.api.dto.VerifyOtpRequest;
import com.jotter.auth.config.AuthProperties;
import com.jotter.auth.federated.FederatedIdentity;
import com.jotter.auth.federated.FederatedIdentityVerifier;
import com.jotter.auth.token.JwtService;
import com.jotter.auth.token.SessionToken;
import com.jotter.auth.verification.CodeSender;
import com.jotter.auth.verification.OtpChallenge;
import com.jotter.auth.verification.OtpService;
import com.jotter.auth.verification.VerificationCodeStatus;
import com.jotter.common.api.MessageResponse;
import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import com.jotter.user.domain.User;
import com.jotter.user.service.UserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.Optional;

/**
 * 认证业务服务。
 * <p>
 * 职责：注册、验证 OTP、登录、重发 OTP、Google 登录，以及查询当前用户与修改密码。
 * 认证模型：
 * - OTP 是实际的登录凭证，登录流程只下发验证码，不校验密码；
 * - 注册时密码只作为账号的第二凭据保存，"忘记密码"与普通登录共用同一机制；
 * - Google 登录跳过 OTP，首次登录自动创建已验证账号。
 * 状态：未注册 → 待验证 → 已验证；联合登录直接进入已验证。
 * 依赖：UserService、OtpService、CodeSender、FederatedIdentityVerifier、JwtService、AuthProperties（密码策略）。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private static final String OTP_SENT = "OTP sent to your email";
    private static final String OTP_RESENT = "OTP resent successfully";

    private final UserService userService;
    private final OtpService otpService;
    private final CodeSender codeSender;
    private final FederatedIdentityVerifier federatedIdentityVerifier;
    private final JwtService jwtService;
    private final AuthProperties authProperties;

    /**
     * 注册：创建未验证账号（密码哈希与首个 OTP 在同一次插入中写入），随后发送验证码。
     */
    public OtpDispatchResponse signup(SignupRequest request) {
        if (userService.existsByEmail(request.email())) {
            throw new BusinessException(ErrorCode.DUPLICATE_IDENTITY);
        }
        validatePassword(request.password());
        OtpChallenge challenge = otpService.newChallenge();
        User user = User.builder()
                .email(request.email())
                .name(request.name().trim())
                .dateOfBirth(request.dateOfBirth())
                .verified(false)
                .otpCode(challenge.code())
                .otpExpiry(challenge.expiresAt())
                .build();
        userService.create(user, request.password());
        codeSender.sendCode(user.getEmail(), challenge.code(), otpService.expireMinutes());
        return new OtpDispatchResponse(OTP_SENT, user.getId());
    }

    /**
     * 校验 OTP。成功时在一次写入中标记已验证并清除 OTP，然后签发会话令牌。
     */
    public AuthResponse verifyOtp(VerifyOtpRequest request) {
        User user = requireUser(request.userId());
        VerificationCodeStatus status = otpService.verify(user, request.otp());
        if (!status.isSuccess()) {
            log.info("OTP rejected uid={} status={}", user.getId(), status);
            throw new BusinessException(ErrorCode.OTP_INVALID_OR_EXPIRED);
        }
        if (!userService.completeVerification(user, request.otp())) {
            // 校验与清除之间被重发或并发验证覆盖
            throw new BusinessException(ErrorCode.OTP_INVALID_OR_EXPIRED);
        }
        return authenticated(user);
    }

    /**
     * 登录：账号存在即下发新的 OTP（覆盖旧挑战），不要求账号已验证。
     */
    public OtpDispatchResponse signin(SigninRequest request) {
        User user = userService.findByEmail(request.email())
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
        dispatchOtp(user);
        return new OtpDispatchResponse(OTP_SENT, user.getId());
    }

    public MessageResponse resendOtp(ResendOtpRequest request) {
        User user = requireUser(request.userId());
        dispatchOtp(user);
        return new MessageResponse(OTP_RESENT);
    }

    /**
     * Google 登录：校验断言后按邮箱查找账号，不存在则创建已验证的联合账号，随后直接签发令牌。
     */
    public AuthResponse googleAuth(GoogleAuthRequest request) {
        FederatedIdentity identity = federatedIdentityVerifier.verify(request.token());
        User user = userService.findByEmail(identity.email())
                .map(existing -> linkFederatedIdentity(existing, identity))
                .orElseGet(() -> provisionFederatedUser(identity));
        return authenticated(user);
    }

    public AuthUserResponse me(long userId) {
        return mapUser(requireUser(userId));
    }

    /**
     * 修改密码。已有密码的账号必须提供正确的当前密码；仅 Google 账号可直接设置首个密码。
     */
    public MessageResponse changePassword(long userId, ChangePasswordRequest request) {
        User user = requireUser(userId);
        if (user.hasPassword() && !userService.comparePassword(user, request.currentPassword())) {
            throw new BusinessException(ErrorCode.INVALID_CREDENTIALS);
        }
        validatePassword(request.newPassword());
        userService.changePassword(user, request.newPassword());
        log.info("Password changed uid={}", user.getId());
        return new MessageResponse("Password updated successfully");
    }

    private void validatePassword(String password) {
        if (!StringUtils.hasText(password)) {
            throw new BusinessException(ErrorCode.VALIDATION_FAILED, "Password is required");
        }
        int minLength = authProperties.getPassword().getMinLength();
        if (password.length() < minLength) {
            throw new BusinessException(ErrorCode.VALIDATION_FAILED,
                    "Password must be at least " + minLength + " characters");
        }
    }

    private void dispatchOtp(User user) {
        String code = otpService.issue(user);
        codeSender.sendCode(user.getEmail(), code, otpService.expireMinutes());
    }

    private User linkFederatedIdentity(User user, FederatedIdentity identity) {
        if (user.hasFederatedIdentity()) {
            return user;
        }
        user.setFederatedId(identity.subject());
        log.info("Federated identity linked uid={}", user.getId());
        return userService.save(user);
    }

    private User provisionFederatedUser(FederatedIdentity identity) {
        User user = User.builder()
                .email(identity.email())
                .name(identity.name())
                .federatedId(identity.subject())
                .verified(true)
                .build();
        try {
            return userService.create(user, null);
        } catch (BusinessException ex) {
            if (ex.getErrorCode() != ErrorCode.DUPLICATE_IDENTITY) {
                throw ex;
            }
            // 并发的首次登录已创建同邮箱账号，复用之
            Optional<User> existing = userService.findByEmail(identity.email());
            return existing.map(found -> linkFederatedIdentity(found, identity)).orElseThrow(() -> ex);
        }
    }

    private User requireUser(Long userId) {
        if (userId == null) {
            throw new BusinessException(ErrorCode.USER_NOT_FOUND);
        }
        return userService.findById(userId)
                .orElseThrow(() -> new BusinessException(ErrorCode.USER_NOT_FOUND));
    }

    private AuthResponse authenticated(User user) {
        SessionToken token = jwtService.issue(user.getId());
        log.info("User authenticated uid={}", user.getId());
        return new AuthResponse(token.token(), token.expiresAt(), mapUser(user));
    }

    private AuthUserResponse mapUser(User user) {
        return new AuthUserResponse(user.getId(), user.getEmail(), user.getName());
    }
}
