package com.discusscall.core.controller;

import com.discusscall.core.error.CallErrorType;
import com.discusscall.core.model.CallInvitation;
import com.discusscall.core.model.CallResult;
import com.discusscall.core.model.CallServiceStatus;
import com.discusscall.core.model.CallSession;
import com.discusscall.core.model.CallStatus;
import com.discusscall.core.model.CallStrategyType;
import com.discusscall.core.model.InvitationSource;
import com.discusscall.core.model.MediaKind;
import com.discusscall.core.notify.InvitationDispatcher;
import com.discusscall.core.session.CallSessionManager;
import com.discusscall.core.strategy.SignalingOnlyCallStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class CallControllerTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private CallSessionManager manager;
    @Mock
    private InvitationDispatcher dispatcher;
    @Mock
    private SignalingOnlyCallStrategy signalingOnly;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        mvc = MockMvcBuilders.standaloneSetup(new CallController(manager, dispatcher, signalingOnly)).build();
    }

    @Test
    void startReturnsTheNewCall() throws Exception {
        CallSession call = CallSession.connecting(7, "Ops", MediaKind.AUDIO_VIDEO, NOW);
        call.setCallId("webrtc-42-1714557600000");
        call.setStrategy(CallStrategyType.FULL_MEDIA);
        when(manager.startCall(7L, "Ops", MediaKind.AUDIO_VIDEO)).thenReturn(CallResult.ok(call));

        mvc.perform(post("/api/calls").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":7,\"conversationName\":\"Ops\",\"video\":true}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.call.callId").value("webrtc-42-1714557600000"))
                .andExpect(jsonPath("$.call.status").value("CONNECTING"));
    }

    @Test
    void failedStartIsAConflictWithFriendlyMessage() throws Exception {
        when(manager.startCall(eq(9L), any(), eq(MediaKind.AUDIO)))
                .thenReturn(CallResult.failed(CallErrorType.NO_MEMBERSHIP));

        mvc.perform(post("/api/calls").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"conversationId\":9}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.errorType").value("NO_MEMBERSHIP"))
                .andExpect(jsonPath("$.message").value(CallResult.START_FAILED_MESSAGE));
    }

    @Test
    void answeringUnknownInvitationIs404() throws Exception {
        when(dispatcher.findPending("rtc-1")).thenReturn(Optional.empty());

        mvc.perform(post("/api/calls/answer").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callId\":\"rtc-1\"}"))
                .andExpect(status().isNotFound());
        verify(manager, never()).answerCall(any());
    }

    @Test
    void answeringPendingInvitationHandsItToTheStateMachine() throws Exception {
        CallInvitation inv = CallInvitation.builder()
                .callId("rtc-42").channelId(7).fromUserId(99).fromUserName("Alex")
                .mediaKind(MediaKind.AUDIO).receivedAt(NOW).registryId(42L)
                .source(InvitationSource.REGISTRY_RECORD).build();
        CallSession call = CallSession.connecting(7, "Alex", MediaKind.AUDIO, NOW);
        when(dispatcher.findPending("rtc-42")).thenReturn(Optional.of(inv));
        when(manager.answerCall(inv)).thenReturn(CallResult.ok(call));

        mvc.perform(post("/api/calls/answer").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callId\":\"rtc-42\"}"))
                .andExpect(status().isOk());
    }

    @Test
    void declineReportsWhetherSomethingWasRinging() throws Exception {
        when(dispatcher.declineInvitation("rtc-42")).thenReturn(true);
        when(dispatcher.declineInvitation("rtc-43")).thenReturn(false);

        mvc.perform(post("/api/calls/decline").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callId\":\"rtc-42\"}"))
                .andExpect(status().isNoContent());
        mvc.perform(post("/api/calls/decline").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"callId\":\"rtc-43\"}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void noCurrentCallIs204() throws Exception {
        when(manager.getCurrentCall()).thenReturn(Optional.empty());

        mvc.perform(get("/api/calls/current")).andExpect(status().isNoContent());
    }

    @Test
    void endReturnsIdleStatus() throws Exception {
        when(manager.getStatus()).thenReturn(CallServiceStatus.builder()
                .initialized(true).status(CallStatus.IDLE).strategy(CallStrategyType.FULL_MEDIA).build());

        mvc.perform(post("/api/calls/end"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("IDLE"))
                .andExpect(jsonPath("$.activeCall").value(false));
        verify(manager).endCall();
    }

    @Test
    void togglesReportNewState() throws Exception {
        when(manager.toggleAudio()).thenReturn(true);
        when(manager.toggleVideo()).thenReturn(false);

        mvc.perform(post("/api/calls/audio/toggle")).andExpect(jsonPath("$.muted").value(true));
        mvc.perform(post("/api/calls/video/toggle")).andExpect(jsonPath("$.cameraOn").value(false));
    }

    @Test
    void pendingInvitationsAreListed() throws Exception {
        when(dispatcher.getPendingInvitations()).thenReturn(List.of(CallInvitation.builder()
                .callId("rtc-42").channelId(7).fromUserId(99).fromUserName("Alex")
                .mediaKind(MediaKind.AUDIO_VIDEO).receivedAt(NOW).source(InvitationSource.REGISTRY_RECORD).build()));

        mvc.perform(get("/api/calls/invitations"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].callId").value("rtc-42"))
                .andExpect(jsonPath("$[0].video").value(true));
    }

    @Test
    void signalingSelfCheck() throws Exception {
        when(signalingOnly.verifyTransport(7L)).thenReturn(true);

        mvc.perform(post("/api/calls/signaling/verify").param("conversationId", "7"))
                .andExpect(jsonPath("$.reachable").value(true));
    }

    @Test
    void unexpectedErrorsBecome500() throws Exception {
        when(manager.getStatus()).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/calls/status"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.error").value("boom"));
    }
}
