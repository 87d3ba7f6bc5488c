package com.discusscall.core.controller;

import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallResult;
import com.discusscall.core.model.CallServiceStatus;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.InvitationActionRequest;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.model.StartCallRequest;
import com.discusscall.core.notify.InvitationDispatcher;
import com.discusscall.core.session.CallSessionManager;
import com.discusscall.core.strategy.SignalingOnlyCallStrategy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/calls")
@Slf4j
@RequiredArgsConstructor
public class CallController {

    private final CallSessionManager manager;
    private final InvitationDispatcher dispatcher;
    private final SignalingOnlyCallStrategy signalingOnly;

    /**
     * 发起通话。失败时返回 409，body 里是统一的提示文案和错误类型。
     */
    @PostMapping
    public ResponseEntity<CallResult> start(@RequestBody StartCallRequest req) {
        log.info("收到发起通话请求: conversation={}, video={}", req.getConversationId(), req.isVideo());
        CallResult result = manager.startCall(req.getConversationId(), req.getConversationName(),
                MediaKind.fromVideoFlag(req.isVideo()));
        return toResponse(result);
    }

    /**
     * 接听一条还在响铃的来电，callId 不在响铃列表里时 404。
     */
    @PostMapping("/answer")
    public ResponseEntity<CallResult> answer(@RequestBody InvitationActionRequest req) {
        Optional<CallInvitation> invitation = dispatcher.findPending(req.getCallId());
        if (invitation.isEmpty()) {
            log.info("Answer for unknown invitation {}", req.getCallId());
            return ResponseEntity.notFound().build();
        }
        return toResponse(manager.answerCall(invitation.get()));
    }

    @PostMapping("/decline")
    public ResponseEntity<Void> decline(@RequestBody InvitationActionRequest req) {
        return dispatcher.declineInvitation(req.getCallId())
                ? ResponseEntity.noContent().build()
                : ResponseEntity.notFound().build();
    }

    @PostMapping("/end")
    public CallServiceStatus end() {
        manager.endCall();
        return manager.getStatus();
    }

    @PostMapping("/audio/toggle")
    public Map<String, Boolean> toggleAudio() {
        return Map.of("muted", manager.toggleAudio());
    }

    @PostMapping("/video/toggle")
    public Map<String, Boolean> toggleVideo() {
        return Map.of("cameraOn", manager.toggleVideo());
    }

    /** 没有通话时 204 */
    @GetMapping("/current")
    public ResponseEntity<CallSession> current() {
        return manager.getCurrentCall()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @GetMapping("/status")
    public CallServiceStatus status() {
        return manager.getStatus();
    }

    @GetMapping("/invitations")
    public List<CallInvitation> invitations() {
        return dispatcher.getPendingInvitations();
    }

    /** 信令链路自检：发一个探测 offer 和 ICE */
    @PostMapping("/signaling/verify")
    public Map<String, Boolean> verifySignaling(@RequestParam("conversationId") long conversationId) {
        return Map.of("reachable", signalingOnly.verifyTransport(conversationId));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<Map<String, String>> handleUnexpected(RuntimeException e) {
        log.error("Call API failed", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(Map.of("error", String.valueOf(e.getMessage())));
    }

    private static ResponseEntity<CallResult> toResponse(CallResult result) {
        return result.isSuccess()
                ? ResponseEntity.ok(result)
                : ResponseEntity.status(HttpStatus.CONFLICT).body(result);
    }
}
