package com.jotter.auth.api.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * 修改密码请求。仅通过 Google 创建、尚未设置密码的账号可以不填当前密码。
 */
public record ChangePasswordRequest(
        String currentPassword,
        @NotBlank @Size(max = 72) String newPassword
) {
}
