package com.jotter.user.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.util.StringUtils;

import java.time.Instant;
import java.time.LocalDate;

/**
 * 用户账号。
 *
 * <p>{@code passwordHash} 与 {@code federatedId} 至少其一存在；
 * {@code otpCode} 与 {@code otpExpiry} 总是成对写入、成对清除。</p>
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private Long id;
    private String email;
    private String name;
    private LocalDate dateOfBirth;
    private String passwordHash;
    private String federatedId;
    private boolean verified;
    private String otpCode;
    private Instant otpExpiry;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasPassword() {
        return StringUtils.hasText(passwordHash);
    }

    public boolean hasFederatedIdentity() {
        return StringUtils.hasText(federatedId);
    }

    public void clearOtp() {
        this.otpCode = null;
        this.otpExpiry = null;
    }
}
