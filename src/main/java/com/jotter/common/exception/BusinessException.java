package com.jotter.common.exception;

import lombok.Getter;

/**
 * 业务异常。
 *
 * <p>服务层在请求被拒绝或外部依赖失败时抛出，携带 {@link ErrorCode}，
 * 由 {@link GlobalExceptionHandler} 按错误码选择 HTTP 状态。</p>
 */
@Getter
public class BusinessException extends RuntimeException {

    private final ErrorCode errorCode;

    public BusinessException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    public BusinessException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    /**
     * 保留底层异常，便于日志追踪存储或投递故障。
     */
    public BusinessException(ErrorCode errorCode, Throwable cause) {
        super(errorCode.getDefaultMessage(), cause);
        this.errorCode = errorCode;
    }
}
