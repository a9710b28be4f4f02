package com.jotter.auth.federated;

import com.jotter.auth.config.AuthProperties;
import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimNames;
import org.springframework.security.oauth2.jwt.JwtClaimValidator;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtTimestampValidator;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.util.StringUtils;

import java.util.Collection;
import java.util.List;

/**
 * Google ID Token 校验器。
 * <p>
 * 使用 Spring Security 的 {@link NimbusJwtDecoder} 按 Google 公开的 JWK 集校验签名，并附加：
 * - 过期时间校验；
 * - 签发方必须是 Google；
 * - 受众必须包含本应用注册的 client id。
 * 校验通过后再检查邮箱声明：缺失邮箱或 {@code email_verified=false} 均视为无效断言。
 */
@Slf4j
public class GoogleIdentityVerifier implements FederatedIdentityVerifier {

    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_EMAIL_VERIFIED = "email_verified";
    static final String CLAIM_NAME = "name";
    // 与 users.name 列宽一致
    static final int MAX_NAME_LENGTH = 100;

    private final JwtDecoder decoder;

    public GoogleIdentityVerifier(JwtDecoder decoder) {
        this.decoder = decoder;
    }

    public static NimbusJwtDecoder createDecoder(AuthProperties.Google google) {
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withJwkSetUri(google.getJwkSetUri()).build();
        decoder.setJwtValidator(validator(google.getClientId(), google.getIssuers()));
        return decoder;
    }

    public static OAuth2TokenValidator<Jwt> validator(String clientId, Collection<String> issuers) {
        List<String> allowedIssuers = List.copyOf(issuers);
        return new DelegatingOAuth2TokenValidator<>(
                new JwtTimestampValidator(),
                new JwtClaimValidator<Object>(JwtClaimNames.ISS,
                        iss -> iss != null && allowedIssuers.contains(iss.toString())),
                new JwtClaimValidator<Collection<String>>(JwtClaimNames.AUD,
                        aud -> StringUtils.hasText(clientId) && aud != null && aud.contains(clientId))
        );
    }

    @Override
    public FederatedIdentity verify(String idToken) {
        if (!StringUtils.hasText(idToken)) {
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        Jwt jwt;
        try {
            jwt = decoder.decode(idToken);
        } catch (JwtException ex) {
            log.warn("Google id token rejected: {}", ex.getMessage());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }

        String email = jwt.getClaimAsString(CLAIM_EMAIL);
        if (!StringUtils.hasText(email)) {
            log.warn("Google id token without email sub={}", jwt.getSubject());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        if (jwt.hasClaim(CLAIM_EMAIL_VERIFIED) && Boolean.FALSE.equals(jwt.getClaimAsBoolean(CLAIM_EMAIL_VERIFIED))) {
            log.warn("Google id token with unverified email sub={}", jwt.getSubject());
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        if (!StringUtils.hasText(jwt.getSubject())) {
            throw new BusinessException(ErrorCode.INVALID_TOKEN);
        }
        return new FederatedIdentity(jwt.getSubject(), email, resolveName(jwt.getClaimAsString(CLAIM_NAME), email));
    }

    // 名称缺失时退回邮箱本地部分，超长按码点截断
    private static String resolveName(String name, String email) {
        String resolved;
        if (StringUtils.hasText(name)) {
            resolved = name.trim();
        } else {
            int at = email.indexOf('@');
            resolved = at > 0 ? email.substring(0, at) : email;
        }
        if (resolved.codePointCount(0, resolved.length()) > MAX_NAME_LENGTH) {
            resolved = resolved.substring(0, resolved.offsetByCodePoints(0, MAX_NAME_LENGTH)).trim();
        }
        return resolved;
    }
}
