package com.webchat.chatbackend.user;

import com.webchat.chatbackend.auth.CustomUserDetails;
import com.webchat.chatbackend.moderation.ModerationGuard;
import com.webchat.chatbackend.shared.StatusResponse;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import lombok.RequiredArgsConstructor;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
public class UserController {

    private final UserService userService;
    private final ModerationGuard moderationGuard;

    @GetMapping("/search")
    public List<UserSummaryDto> search(@RequestParam(required = false) String query,
                                       @AuthenticationPrincipal CustomUserDetails principal) {
        return userService.search(principal.getId(), query);
    }

    @PostMapping("/{userId}/block")
    public StatusResponse block(@PathVariable Long userId,
                                @AuthenticationPrincipal CustomUserDetails principal) {
        moderationGuard.blockUser(principal.getId(), userId);
        return StatusResponse.success("User blocked");
    }

    @DeleteMapping("/{userId}/block")
    public StatusResponse unblock(@PathVariable Long userId,
                                  @AuthenticationPrincipal CustomUserDetails principal) {
        moderationGuard.unblockUser(principal.getId(), userId);
        return StatusResponse.success("User unblocked");
    }

    @GetMapping("/blocked")
    public List<UserSummaryDto> blocked(@AuthenticationPrincipal CustomUserDetails principal) {
        return moderationGuard.listBlocked(principal.getId());
    }
}
