package com.jotter.auth.verification;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * 开发/测试用验证码发送器。
 * <p>
 * 不实际发送，仅记录日志，便于本地开发（{@code dev} profile）与集成测试。
 * 验证码本身只在 DEBUG 级别输出。
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "auth.notification", name = "channel", havingValue = "log", matchIfMissing = true)
public class LoggingCodeSender implements CodeSender {

    @Override
    public void sendCode(String email, String code, int expireMinutes) {
        log.info("OTP dispatched to log channel email={} expireMinutes={}", email, expireMinutes);
        log.debug("OTP for email={} code={}", email, code);
    }
}
