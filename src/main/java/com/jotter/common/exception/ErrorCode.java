package com.jotter.common.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * 业务错误码。
 *
 * <p>每个错误码携带稳定的 {@code code}、默认文案、对应的 HTTP 状态，以及是否属于可重试的运行时故障。</p>
 * <p>仅 {@link #DELIVERY_FAILED} 与 {@link #STORE_UNAVAILABLE} 为运行时故障，其余均为对请求本身的语义拒绝。</p>
 */
@Getter
public enum ErrorCode {

    VALIDATION_FAILED("VALIDATION_FAILED", "Invalid request", HttpStatus.BAD_REQUEST, false),
    DUPLICATE_IDENTITY("DUPLICATE_IDENTITY", "User already exists", HttpStatus.CONFLICT, false),
    USER_NOT_FOUND("USER_NOT_FOUND", "User not found", HttpStatus.NOT_FOUND, false),
    OTP_INVALID_OR_EXPIRED("OTP_INVALID_OR_EXPIRED", "Invalid or expired OTP", HttpStatus.BAD_REQUEST, false),
    INVALID_TOKEN("INVALID_TOKEN", "Invalid token", HttpStatus.UNAUTHORIZED, false),
    INVALID_CREDENTIALS("INVALID_CREDENTIALS", "Current password is incorrect", HttpStatus.UNAUTHORIZED, false),
    NOTE_NOT_FOUND("NOTE_NOT_FOUND", "Note not found", HttpStatus.NOT_FOUND, false),
    RESOURCE_NOT_FOUND("RESOURCE_NOT_FOUND", "Resource not found", HttpStatus.NOT_FOUND, false),
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", "Method not allowed", HttpStatus.METHOD_NOT_ALLOWED, false),
    DELIVERY_FAILED("DELIVERY_FAILED", "Failed to send OTP", HttpStatus.BAD_GATEWAY, true),
    STORE_UNAVAILABLE("STORE_UNAVAILABLE", "Storage temporarily unavailable, please retry later", HttpStatus.SERVICE_UNAVAILABLE, true);

    private final String code;
    private final String defaultMessage;
    private final HttpStatus status;
    private final boolean transientFailure;

    ErrorCode(String code, String defaultMessage, HttpStatus status, boolean transientFailure) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.status = status;
        this.transientFailure = transientFailure;
    }
}
