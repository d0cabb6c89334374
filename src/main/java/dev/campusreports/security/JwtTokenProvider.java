package dev.campusreports.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

/**
 * Issues and verifies HS512 access tokens. The subject is the user id and the {@code role}
 * claim carries the user's role.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String ISSUER = "campus-reports";
    static final String AUDIENCE = "campus-reports-api";
    static final String ROLE_CLAIM = "role";

    /** HS512 needs at least 512 bits of key material. */
    private static final int MIN_SECRET_LENGTH = 64;

    @Value("${jwt.secret}")
    private String secret;

    @Value("${jwt.expiration}")
    private long expiration;

    private SecretKey key;
    private JwtParser jwtParser;

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret must be at least %d characters for HS512. Current length: %d",
                    MIN_SECRET_LENGTH, secret == null ? 0 : secret.length()));
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized with HS512 algorithm");
    }

    public String generateToken(Long userId, String role) {
        Instant now = Instant.now();
        log.debug("Issuing token for user {}", userId);
        return Jwts.builder()
                .id(UUID.randomUUID().toString())
                .subject(String.valueOf(userId))
                .claim(ROLE_CLAIM, role)
                .issuer(ISSUER)
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plusMillis(expiration)))
                .signWith(key, Jwts.SIG.HS512)
                .compact();
    }

    public long getExpirationSeconds() {
        return expiration / 1000;
    }

    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }

        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }

        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    /**
     * Verifies signature, issuer, audience and expiry in one pass.
     */
    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            return TokenValidationResult.success(jwtParser.parseSignedClaims(token).getPayload());
        } catch (ExpiredJwtException e) {
            log.debug("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty or null token");
        }
    }
}
