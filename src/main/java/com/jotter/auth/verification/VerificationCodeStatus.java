package com.jotter.auth.verification;

// 分别对应：成功、没有待验证的挑战、已过期、不匹配
public enum VerificationCodeStatus {
    SUCCESS,
    NOT_FOUND,
    EXPIRED,
    MISMATCH;

    public boolean isSuccess() {
        return this == SUCCESS;
    }
}
