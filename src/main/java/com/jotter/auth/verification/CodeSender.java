package com.jotter.auth.verification;

/**
 * 验证码发送器接口。
 * <p>
 * 抽象真实的投递行为（邮件/日志），发送失败时抛出
 * {@code BusinessException(ErrorCode.DELIVERY_FAILED)}，由调用方透传给请求方。
 */
public interface CodeSender {

    void sendCode(String email, String code, int expireMinutes);
}
