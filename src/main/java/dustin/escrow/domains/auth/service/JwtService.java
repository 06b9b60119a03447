package dustin.escrow.domains.auth.service;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import dustin.escrow.config.EscrowProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

/**
 * JWT 서비스
 * JWT Service for caller tokens
 *
 * 토큰 subject가 호출자 식별자(계정)입니다.
 * 토큰 발급은 외부 인증 서버 또는 운영 도구가 같은 secret으로 수행합니다.
 */
@Service
public class JwtService {

    private final SecretKey secretKey;
    private final long tokenTtlMinutes;

    public JwtService(EscrowProperties properties) {
        this.secretKey = Keys.hmacShaKeyFor(properties.getAuth().getJwtSecret().getBytes(StandardCharsets.UTF_8));
        this.tokenTtlMinutes = properties.getAuth().getTokenTtlMinutes();
    }

    /**
     * 호출자 토큰 발급
     * Issue caller token
     */
    public String issueCallerToken(String accountId) {
        Instant now = Instant.now();
        Instant expiration = now.plus(tokenTtlMinutes, ChronoUnit.MINUTES);

        return Jwts.builder()
                .subject(accountId)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey)
                .compact();
    }

    /**
     * 토큰 검증 후 호출자 식별자 반환
     * Verify token and extract caller id
     *
     * @throws RuntimeException 서명 불일치, 만료, subject 없음
     */
    public String verifyCallerToken(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            throw new RuntimeException("Invalid or expired token", e);
        }
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw new RuntimeException("Token has no subject");
        }
        return subject;
    }
}
