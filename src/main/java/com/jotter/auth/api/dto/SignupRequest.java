package com.jotter.auth.api.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

/**
 * 注册请求。密码必填，保证账号至少有一种凭据。
 */
public record SignupRequest(
        @NotBlank @Email String email,
        @NotBlank @Size(max = 100) String name,
        @Past LocalDate dateOfBirth,
        @NotBlank @Size(max = 72) String password
) {
}
