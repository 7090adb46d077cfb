package com.webchat.chatbackend.auth;

import com.webchat.chatbackend.shared.ChatException;
import com.webchat.chatbackend.user.User;
import com.webchat.chatbackend.user.UserRepository;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    @PostMapping("/register")
    public ResponseEntity<AuthResponse> register(@Valid @RequestBody RegisterRequest request) {
        if (userRepository.existsByUsernameIgnoreCase(request.username())) {
            throw ChatException.conflict("Username is already taken");
        }
        if (userRepository.existsByEmailIgnoreCase(request.email())) {
            throw ChatException.conflict("Email is already registered");
        }

        User user = new User();
        user.setUsername(request.username().trim());
        user.setEmail(request.email().trim().toLowerCase());
        user.setPassword(passwordEncoder.encode(request.password()));
        user.setAvatarUrl(request.avatarUrl());
        user = userRepository.save(user);

        log.info("Registered user id={} username={}", user.getId(), user.getUsername());
        return ResponseEntity.status(HttpStatus.CREATED).body(issue(user));
    }

    @PostMapping("/login")
    public AuthResponse login(@Valid @RequestBody LoginRequest request) {
        User user = userRepository.findByUsername(request.username())
                .filter(u -> passwordEncoder.matches(request.password(), u.getPassword()))
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Incorrect username or password"));
        return issue(user);
    }

    @GetMapping("/me")
    public UserSummaryDto me(@AuthenticationPrincipal CustomUserDetails principal) {
        return UserSummaryDto.from(principal.getUser());
    }

    private AuthResponse issue(User user) {
        return new AuthResponse(jwtService.generateToken(user), "bearer", UserSummaryDto.from(user));
    }
}
