package com.webchat.chatbackend.realtime;

import com.webchat.chatbackend.auth.JwtService;
import com.webchat.chatbackend.user.User;
import com.webchat.chatbackend.user.UserRepository;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Optional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JwtConnectionAuthenticator implements ConnectionAuthenticator {

    private final JwtService jwtService;
    private final UserRepository userRepository;

    @Override
    public Optional<Long> authenticate(String token) {
        if (!StringUtils.hasText(token)) {
            return Optional.empty();
        }
        try {
            Claims claims = jwtService.parse(token);
            Long issuedFor = jwtService.userIdOf(claims);
            Optional<Long> userId = userRepository.findByUsername(claims.getSubject()).map(User::getId);
            if (issuedFor != null && userId.isPresent() && !issuedFor.equals(userId.get())) {
                log.warn("Rejected socket token for {}: issued to account {}, now {}",
                        claims.getSubject(), issuedFor, userId.get());
                return Optional.empty();
            }
            return userId;
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired socket token for {}", e.getClaims().getSubject());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected socket token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
