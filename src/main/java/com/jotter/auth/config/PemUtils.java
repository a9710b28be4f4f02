package com.jotter.auth.config;

import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.interfaces.RSAPrivateKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.PKCS8EncodedKeySpec;
import java.security.spec.X509EncodedKeySpec;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * PEM 密钥读取工具。
 * <p>
 * 会话令牌签名密钥只在启动时读取一次：私钥为 PKCS#8（{@code PRIVATE KEY}），公钥为 X.509（{@code PUBLIC KEY}）。
 */
public final class PemUtils {

    private static final Pattern ARMOR = Pattern.compile("-----(BEGIN|END) [A-Z ]+-----");
    private static final Pattern WHITESPACE = Pattern.compile("\\s");

    private PemUtils() {
    }

    public static RSAPrivateKey readPrivateKey(Resource resource) {
        byte[] der = decode(resource, "PRIVATE KEY");
        try {
            return (RSAPrivateKey) rsaKeyFactory().generatePrivate(new PKCS8EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Invalid RSA private key: " + describe(resource), ex);
        }
    }

    public static RSAPublicKey readPublicKey(Resource resource) {
        byte[] der = decode(resource, "PUBLIC KEY");
        try {
            return (RSAPublicKey) rsaKeyFactory().generatePublic(new X509EncodedKeySpec(der));
        } catch (GeneralSecurityException ex) {
            throw new IllegalStateException("Invalid RSA public key: " + describe(resource), ex);
        }
    }

    private static byte[] decode(Resource resource, String expectedType) {
        if (resource == null || !resource.exists()) {
            throw new IllegalStateException("Missing " + expectedType + " resource: " + describe(resource));
        }
        String pem;
        try (InputStream is = resource.getInputStream()) {
            pem = new String(is.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new IllegalStateException("Failed to read " + describe(resource), ex);
        }
        if (!pem.contains("-----BEGIN " + expectedType + "-----")) {
            throw new IllegalStateException("Expected " + expectedType + " in " + describe(resource));
        }
        String body = WHITESPACE.matcher(ARMOR.matcher(pem).replaceAll("")).replaceAll("");
        return Base64.getDecoder().decode(body);
    }

    private static KeyFactory rsaKeyFactory() throws GeneralSecurityException {
        return KeyFactory.getInstance("RSA");
    }

    private static String describe(Resource resource) {
        return resource == null ? "<unset>" : resource.getDescription();
    }
}
