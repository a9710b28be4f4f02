package com.jotter.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.core.io.Resource;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Data
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private final Jwt jwt = new Jwt();
    private final Otp otp = new Otp();
    private final Password password = new Password();
    private final Google google = new Google();
    private final Notification notification = new Notification();
    private final Cors cors = new Cors();

    @Data
    public static class Jwt {
        private String issuer = "jotter";
        private Duration tokenTtl = Duration.ofDays(7);
        private String keyId = "jotter-key";
        private Resource privateKey;
        private Resource publicKey;
    }

    @Data
    public static class Otp {
        private Duration ttl = Duration.ofMinutes(10);
    }

    @Data
    public static class Password {
        private int bcryptStrength = 10;
        private int minLength = 6;
    }

    @Data
    public static class Google {
        private String clientId;
        private String jwkSetUri = "https://www.googleapis.com/oauth2/v3/certs";
        private List<String> issuers = new ArrayList<>(List.of("accounts.google.com", "https://accounts.google.com"));
    }

    @Data
    public static class Notification {
        // log | mail
        private String channel = "log";
        private String from;
        private String subject = "Your OTP for Note App";
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:5173"));
    }
}
