package com.jotter.auth.token;

import com.jotter.auth.config.AuthProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtDecoder;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * 会话令牌服务。
 * <p>
 * 签发 RS256 JWT：`sub` 与 `uid` 均为用户 ID，`iat`/`exp` 为签发与绝对过期时间，`jti` 为随机令牌 ID。
 * 令牌无状态，不做服务端存储，也不支持吊销；持有公钥即可离线校验。
 * 过期时间：来自 `AuthProperties.jwt.tokenTtl`。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JwtService {

    static final String CLAIM_USER_ID = "uid";

    private final JwtEncoder jwtEncoder;
    private final JwtDecoder jwtDecoder;
    private final AuthProperties properties;
    private final Clock clock;

    public SessionToken issue(long userId) {
        Instant issuedAt = Instant.now(clock);
        Instant expiresAt = issuedAt.plus(properties.getJwt().getTokenTtl());
        JwtClaimsSet claims = JwtClaimsSet.builder()
                .issuer(properties.getJwt().getIssuer())
                .issuedAt(issuedAt)
                .expiresAt(expiresAt)
                .subject(String.valueOf(userId))
                .id(UUID.randomUUID().toString())
                .claim(CLAIM_USER_ID, userId)
                .build();
        String token = jwtEncoder.encode(JwtEncoderParameters.from(claims)).getTokenValue();
        log.debug("Session token issued uid={} exp={}", userId, expiresAt);
        return new SessionToken(token, issuedAt, expiresAt);
    }

    public Jwt decode(String token) {
        return jwtDecoder.decode(token);
    }

    public long extractUserId(Jwt jwt) {
        Object claim = jwt.getClaims().get(CLAIM_USER_ID);
        if (claim instanceof Number number) {
            return number.longValue();
        }
        if (claim instanceof String text) {
            return Long.parseLong(text);
        }
        if (jwt.getSubject() != null) {
            return Long.parseLong(jwt.getSubject());
        }
        throw new IllegalArgumentException("Invalid user id in token");
    }
}
