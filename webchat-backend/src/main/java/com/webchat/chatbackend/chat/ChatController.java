package com.webchat.chatbackend.chat;

import com.webchat.chatbackend.auth.CustomUserDetails;
import com.webchat.chatbackend.chat.dto.AddMembersRequest;
import com.webchat.chatbackend.chat.dto.ChatSummaryDto;
import com.webchat.chatbackend.chat.dto.CreateDirectRequest;
import com.webchat.chatbackend.chat.dto.CreateGroupRequest;
import com.webchat.chatbackend.chat.dto.MessageDto;
import com.webchat.chatbackend.chat.dto.ReactionRequest;
import com.webchat.chatbackend.chat.dto.ReactionResult;
import com.webchat.chatbackend.shared.StatusResponse;
import com.webchat.chatbackend.user.dto.UserSummaryDto;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/chats")
@RequiredArgsConstructor
public class ChatController {

    private final ConversationService conversationService;

    @GetMapping
    public List<ChatSummaryDto> myChats(@AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.getUserChats(principal.getId());
    }

    @PostMapping
    public ChatSummaryDto openDirect(@Valid @RequestBody CreateDirectRequest request,
                                     @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.findOrCreateDirect(principal.getId(), request.participantId());
    }

    @PostMapping("/group")
    public ResponseEntity<ChatSummaryDto> createGroup(@Valid @RequestBody CreateGroupRequest request,
                                                      @AuthenticationPrincipal CustomUserDetails principal) {
        ChatSummaryDto group = conversationService.createGroup(principal.getId(), request.participantIds(), request.name());
        return ResponseEntity.status(HttpStatus.CREATED).body(group);
    }

    @GetMapping("/{chatId}")
    public ChatSummaryDto getChat(@PathVariable Long chatId,
                                  @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.getChat(principal.getId(), chatId);
    }

    @GetMapping("/{chatId}/messages")
    public List<MessageDto> messages(@PathVariable Long chatId,
                                     @RequestParam(required = false) String query,
                                     @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.getMessages(principal.getId(), chatId, query);
    }

    @PostMapping(value = "/{chatId}/messages", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public MessageDto send(@PathVariable Long chatId,
                           @RequestParam(value = "text", required = false) String text,
                           @RequestParam(value = "files", required = false) List<MultipartFile> files,
                           @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.sendMessage(principal.getId(), chatId, text, files);
    }

    @DeleteMapping("/{chatId}/messages/{messageId}")
    public StatusResponse deleteMessage(@PathVariable Long chatId,
                                        @PathVariable Long messageId,
                                        @AuthenticationPrincipal CustomUserDetails principal) {
        conversationService.deleteMessage(principal.getId(), chatId, messageId);
        return StatusResponse.success("Message recalled");
    }

    @PostMapping("/{chatId}/messages/{messageId}/reactions")
    public ReactionResult react(@PathVariable Long chatId,
                                @PathVariable Long messageId,
                                @Valid @RequestBody ReactionRequest request,
                                @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.toggleReaction(principal.getId(), chatId, messageId, request.emoji());
    }

    @PostMapping("/{chatId}/read")
    public StatusResponse markRead(@PathVariable Long chatId,
                                   @AuthenticationPrincipal CustomUserDetails principal) {
        conversationService.markRead(principal.getId(), chatId);
        return StatusResponse.success("Marked as read");
    }

    @PostMapping("/{chatId}/leave")
    public StatusResponse leave(@PathVariable Long chatId,
                                @AuthenticationPrincipal CustomUserDetails principal) {
        conversationService.leaveGroup(principal.getId(), chatId);
        return StatusResponse.success("Left the group");
    }

    @PostMapping("/{chatId}/participants")
    public List<UserSummaryDto> addMembers(@PathVariable Long chatId,
                                           @Valid @RequestBody AddMembersRequest request,
                                           @AuthenticationPrincipal CustomUserDetails principal) {
        return conversationService.addMembers(principal.getId(), chatId, request.userIds());
    }

    @DeleteMapping("/{chatId}/participants/{userId}")
    public StatusResponse kick(@PathVariable Long chatId,
                               @PathVariable Long userId,
                               @AuthenticationPrincipal CustomUserDetails principal) {
        conversationService.kickMember(principal.getId(), chatId, userId);
        return StatusResponse.success("Member removed");
    }

    @DeleteMapping("/{chatId}")
    public StatusResponse dissolve(@PathVariable Long chatId,
                                   @AuthenticationPrincipal CustomUserDetails principal) {
        conversationService.dissolveGroup(principal.getId(), chatId);
        return StatusResponse.success("Group dissolved");
    }
}
