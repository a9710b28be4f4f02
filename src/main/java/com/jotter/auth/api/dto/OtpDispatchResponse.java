package com.jotter.auth.api.dto;

/**
 * 验证码已发送的响应，{@code userId} 供客户端随后调用 verify-otp / resend-otp。
 */
public record OtpDispatchResponse(
        String message,
        Long userId
) {
}
