package com.realtime.teamhub.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Optional;
import java.util.UUID;

/**
 * 인증 서비스가 발급한 HS256 액세스 토큰 검증. subject = 사용자 UUID 문자열.
 */
@Slf4j
@Component
public class JwtIdentityVerifier implements IdentityVerifier {

    private static final String HMAC_ALG = "HmacSHA256";
    private final SecretKey accessKey;

    public JwtIdentityVerifier(
            @Value("${jwt.secret}") String accessSecret,
            @Value("${jwt.secret-base64:false}") boolean accessBase64
    ) {
        byte[] bytes = accessBase64
                ? Base64.getDecoder().decode(accessSecret)
                : accessSecret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < 32) {
            throw new IllegalArgumentException("JWT secret length must be >= 32 bytes (256 bits).");
        }
        this.accessKey = new SecretKeySpec(bytes, HMAC_ALG);
    }

    @Override
    public Optional<Identity> verify(String accessToken) {
        if (accessToken == null || accessToken.isBlank()) return Optional.empty();
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(accessKey)
                    .build()
                    .parseSignedClaims(accessToken)
                    .getPayload();
            String sub = claims.getSubject();
            if (sub == null) {
                log.warn("Access token without subject");
                return Optional.empty();
            }
            return Optional.of(new Identity(UUID.fromString(sub), claims.get("email", String.class)));
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("Invalid access token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
