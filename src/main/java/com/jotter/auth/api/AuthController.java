package com.jotter.auth.api;

import com.jotter.auth.api.dto.AuthResponse;
import com.jotter.auth.api.dto.AuthUserResponse;
import com.jotter.auth.api.dto.ChangePasswordRequest;
import com.jotter.auth.api.dto.GoogleAuthRequest;
import com.jotter.auth.api.dto.OtpDispatchResponse;
import com.jotter.auth.api.dto.ResendOtpRequest;
import com.jotter.auth.api.dto.SigninRequest;
import com.jotter.auth.api.dto.SignupRequest;
import com.jotter.auth.api.dto.VerifyOtpRequest;
import com.jotter.auth.service.AuthService;
import com.jotter.auth.token.JwtService;
import com.jotter.common.api.MessageResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * 认证 API 控制器。
 * <p>
 * 暴露 REST 接口：注册、验证 OTP、登录、Google 登录、重发 OTP、查询当前用户、修改密码。
 * `/me` 与 `/password` 通过 `@AuthenticationPrincipal Jwt` 提取用户。
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Validated
public class AuthController {

    private final AuthService authService;
    private final JwtService jwtService;

    @PostMapping("/signup")
    @ResponseStatus(HttpStatus.CREATED)
    public OtpDispatchResponse signup(@Valid @RequestBody SignupRequest request) {
        return authService.signup(request);
    }

    @PostMapping("/verify-otp")
    public AuthResponse verifyOtp(@Valid @RequestBody VerifyOtpRequest request) {
        return authService.verifyOtp(request);
    }

    @PostMapping("/signin")
    public OtpDispatchResponse signin(@Valid @RequestBody SigninRequest request) {
        return authService.signin(request);
    }

    @PostMapping("/google")
    public AuthResponse google(@Valid @RequestBody GoogleAuthRequest request) {
        return authService.googleAuth(request);
    }

    @PostMapping("/resend-otp")
    public MessageResponse resendOtp(@Valid @RequestBody ResendOtpRequest request) {
        return authService.resendOtp(request);
    }

    @GetMapping("/me")
    public AuthUserResponse me(@AuthenticationPrincipal Jwt jwt) {
        return authService.me(jwtService.extractUserId(jwt));
    }

    @PostMapping("/password")
    public MessageResponse changePassword(@AuthenticationPrincipal Jwt jwt,
                                          @Valid @RequestBody ChangePasswordRequest request) {
        return authService.changePassword(jwtService.extractUserId(jwt), request);
    }
}
