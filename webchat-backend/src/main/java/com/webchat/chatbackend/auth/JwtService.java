package com.webchat.chatbackend.auth;

import com.webchat.chatbackend.user.User;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Map;

@Service
public class JwtService {

    static final String USER_ID_CLAIM = "uid";

    private final SecretKey key;
    private final long accessTokenExpirationMs;

    // Secret is raw UTF-8 text in properties and must be at least 256 bits
    public JwtService(
            @Value("${security.jwt.secret}") String secret,
            @Value("${security.jwt.access-token.expiration-ms}") long accessTokenExpirationMs
    ) {
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.accessTokenExpirationMs = accessTokenExpirationMs;
    }

    public String generateToken(User user) {
        long now = System.currentTimeMillis();
        return Jwts.builder()
                .setSubject(user.getUsername())
                .addClaims(Map.of(USER_ID_CLAIM, user.getId()))
                .setIssuedAt(new Date(now))
                .setExpiration(new Date(now + accessTokenExpirationMs))
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * Returns the username carried by the token. Throws a {@link io.jsonwebtoken.JwtException}
     * when the token is malformed, badly signed or expired.
     */
    public String extractUsername(String token) {
        return parse(token).getSubject();
    }

    /** The account id the token was issued for, or null for tokens that predate the claim. */
    public Long userIdOf(Claims claims) {
        Number uid = claims.get(USER_ID_CLAIM, Number.class);
        return uid == null ? null : uid.longValue();
    }

    public boolean isTokenValid(String token, UserDetails userDetails) {
        return userDetails.getUsername().equals(extractUsername(token));
    }

    public Claims parse(String token) {
        return Jwts.parserBuilder()
                .setSigningKey(key)
                .setAllowedClockSkewSeconds(5)
                .build()
                .parseClaimsJws(token)
                .getBody();
    }
}
