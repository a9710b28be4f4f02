package com.jotter.auth.api.dto;

/**
 * 认证用户响应。
 * <p>
 * 对外只暴露 id、邮箱与名称，密码哈希与 OTP 字段永不序列化。
 */
public record AuthUserResponse(
        Long id,
        String email,
        String name
) {
}
