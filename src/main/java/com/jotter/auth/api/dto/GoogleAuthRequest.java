package com.jotter.auth.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Google 登录请求，{@code token} 为前端拿到的 Google ID Token。
 */
public record GoogleAuthRequest(
        @NotBlank String token
) {
}
