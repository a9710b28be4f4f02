package com.jotter.auth.federated;

import com.jotter.common.exception.BusinessException;
import com.jotter.common.exception.ErrorCode;
import com.nimbusds.jose.jwk.JWKSet;
import com.nimbusds.jose.jwk.RSAKey;
import com.nimbusds.jose.jwk.source.ImmutableJWKSet;
import org.assertj.core.api.ThrowableAssert.ThrowingCallable;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoder;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;

import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GoogleIdentityVerifierTest {

    private static final String CLIENT_ID = "jotter-web.apps.googleusercontent.com";
    private static final List<String> ISSUERS = List.of("accounts.google.com", "https://accounts.google.com");

    private static KeyPair providerKeys;
    private static KeyPair foreignKeys;

    private JwtEncoder providerEncoder;
    private GoogleIdentityVerifier verifier;

    @BeforeAll
    static void generateKeys() throws NoSuchAlgorithmException {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048);
        providerKeys = generator.generateKeyPair();
        foreignKeys = generator.generateKeyPair();
    }

    @BeforeEach
    void setUp() {
        providerEncoder = encoder(providerKeys);
        NimbusJwtDecoder decoder = NimbusJwtDecoder.withPublicKey((RSAPublicKey) providerKeys.getPublic()).build();
        decoder.setJwtValidator(GoogleIdentityVerifier.validator(CLIENT_ID, ISSUERS));
        verifier = new GoogleIdentityVerifier(decoder);
    }

    @Test
    void validAssertionYieldsIdentity() {
        String token = sign(providerEncoder, claims -> claims.claim("name", "Ann Lee"));

        FederatedIdentity identity = verifier.verify(token);

        assertThat(identity.subject()).isEqualTo("google-sub-1");
        assertThat(identity.email()).isEqualTo("ann@example.com");
        assertThat(identity.name()).isEqualTo("Ann Lee");
    }

    @Test
    void bareIssuerIsAccepted() {
        String token = sign(providerEncoder, claims -> claims.issuer("accounts.google.com"));

        assertThat(verifier.verify(token).email()).isEqualTo("ann@example.com");
    }

    @Test
    void missingNameFallsBackToEmailLocalPart() {
        String token = sign(providerEncoder, claims -> {
        });

        assertThat(verifier.verify(token).name()).isEqualTo("ann");
    }

    @Test
    void overlongNameIsTruncatedToColumnWidth() {
        String longName = "Ann " + "\uD83D\uDE00".repeat(200);
        String token = sign(providerEncoder, claims -> claims.claim("name", longName));

        String name = verifier.verify(token).name();

        assertThat(name.codePointCount(0, name.length())).isEqualTo(GoogleIdentityVerifier.MAX_NAME_LENGTH);
        assertThat(name).startsWith("Ann ").isEqualTo(longName.substring(0, longName.offsetByCodePoints(0, 100)));
    }

    @Test
    void foreignAudienceIsRejected() {
        String token = sign(providerEncoder, claims -> claims.audience(List.of("someone-else.apps.googleusercontent.com")));

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void expiredAssertionIsRejected() {
        Instant issued = Instant.now().minus(Duration.ofHours(3));
        String token = sign(providerEncoder, claims -> claims.issuedAt(issued).expiresAt(issued.plus(Duration.ofHours(1))));

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void unknownIssuerIsRejected() {
        String token = sign(providerEncoder, claims -> claims.issuer("https://login.example.org"));

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void assertionWithoutEmailIsRejected() {
        String token = sign(providerEncoder, claims -> claims.claims(map -> map.remove("email")));

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void unverifiedEmailIsRejected() {
        String token = sign(providerEncoder, claims -> claims.claim("email_verified", false));

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void assertionSignedByAnotherKeyIsRejected() {
        String token = sign(encoder(foreignKeys), claims -> {
        });

        assertInvalid(() -> verifier.verify(token));
    }

    @Test
    void blankOrMalformedTokenIsRejected() {
        assertInvalid(() -> verifier.verify(" "));
        assertInvalid(() -> verifier.verify("not-a-jwt"));
    }

    private static String sign(JwtEncoder encoder, Consumer<JwtClaimsSet.Builder> customizer) {
        Instant now = Instant.now();
        JwtClaimsSet.Builder claims = JwtClaimsSet.builder()
                .issuer("https://accounts.google.com")
                .subject("google-sub-1")
                .audience(List.of(CLIENT_ID))
                .issuedAt(now)
                .expiresAt(now.plus(Duration.ofHours(1)))
                .claim("email", "ann@example.com")
                .claim("email_verified", true);
        customizer.accept(claims);
        return encoder.encode(JwtEncoderParameters.from(claims.build())).getTokenValue();
    }

    private static JwtEncoder encoder(KeyPair keys) {
        RSAKey jwk = new RSAKey.Builder((RSAPublicKey) keys.getPublic())
                .privateKey((RSAPrivateKey) keys.getPrivate())
                .keyID("google-test-key")
                .build();
        return new NimbusJwtEncoder(new ImmutableJWKSet<>(new JWKSet(jwk)));
    }

    private static void assertInvalid(ThrowingCallable call) {
        assertThatThrownBy(call).isInstanceOfSatisfying(BusinessException.class,
                ex -> assertThat(ex.getErrorCode()).isEqualTo(ErrorCode.INVALID_TOKEN));
    }
}
