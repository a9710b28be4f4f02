package com.jotter.auth.verification;

import com.jotter.auth.config.AuthProperties;
import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * 基于 SMTP 的验证码发送器。
 * <p>
 * 通过 Spring {@link JavaMailSender} 同步发送 HTML 邮件，发件人与主题来自 {@code auth.notification}。
 * 任何投递异常都转换为 {@link ErrorCode#DELIVERY_FAILED}。
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "auth.notification", name = "channel", havingValue = "mail")
public class MailCodeSender implements CodeSender {

    private final JavaMailSender mailSender;
    private final AuthProperties properties;

    @Override
    public void sendCode(String email, String code, int expireMinutes) {
        AuthProperties.Notification cfg = properties.getNotification();
        try {
            MimeMessage message = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(message, false, StandardCharsets.UTF_8.name());
            helper.setFrom(cfg.getFrom());
            helper.setTo(email);
            helper.setSubject(cfg.getSubject());
            helper.setText(renderBody(code, expireMinutes), true);
            mailSender.send(message);
            log.info("OTP mail sent email={}", email);
        } catch (MessagingException | MailException ex) {
            log.warn("OTP mail delivery failed email={}", email, ex);
            throw new BusinessException(ErrorCode.DELIVERY_FAILED, ex);
        }
    }

    static String renderBody(String code, int expireMinutes) {
        return """
                <div style="font-family: Arial, sans-serif; padding: 20px;">
                  <h2>Your OTP Code</h2>
                  <p>Your OTP code is: <strong style="font-size: 24px; color: #4285f4;">%s</strong></p>
                  <p>This code will expire in %d minutes.</p>
                </div>
                """.formatted(code, expireMinutes);
    }
}
