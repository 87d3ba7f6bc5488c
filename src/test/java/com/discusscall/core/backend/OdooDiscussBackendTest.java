package com.discusscall.core.backend;

import com.discusscall.core.model.ChatMessage;
import com.discusscall.core.model.ConversationInfo;
import com.discusscall.core.model.LocalIdentity;
import com.discusscall.core.model.OutgoingMessage;
import com.discusscall.core.model.RegistryRecord;
import com.discusscall.core.model.SessionFlags;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class OdooDiscussBackendTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Mock
    private OdooRpcClient client;

    private OdooDiscussBackend backend;

    @BeforeEach
    void setUp() {
        backend = new OdooDiscussBackend(client);
    }

    @Test
    void identityComesFromTheUsersPartner() throws Exception {
        when(client.uid()).thenReturn(2L);
        when(client.executeKw(eq("res.users"), eq("read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[{\"id\":2,\"partner_id\":[100,\"Mobile Tester\"],\"name\":\"Mobile Tester\"}]"));

        LocalIdentity me = backend.currentIdentity();

        assertThat(me.getUserId()).isEqualTo(2L);
        assertThat(me.getPartnerId()).isEqualTo(100L);
        assertThat(me.getName()).isEqualTo("Mobile Tester");
    }

    @Test
    void userWithoutPartnerIsAnError() throws Exception {
        when(client.uid()).thenReturn(2L);
        when(client.executeKw(eq("res.users"), eq("read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[{\"id\":2,\"partner_id\":false,\"name\":\"x\"}]"));

        assertThatThrownBy(() -> backend.currentIdentity()).isInstanceOf(OdooRpcException.class);
    }

    @Test
    void chatChannelIsDirect() throws Exception {
        when(client.executeKw(eq("discuss.channel"), eq("read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[{\"id\":9,\"name\":\"Alex\",\"channel_type\":\"chat\"}]"));

        ConversationInfo info = backend.readConversation(9);

        assertThat(info.isDirect()).isTrue();
        assertThat(info.getName()).isEqualTo("Alex");
    }

    @Test
    void rtcRowsAreMappedFromMany2oneFields() throws Exception {
        when(client.executeKw(eq("discuss.channel.rtc.session"), eq("search_read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[{\"id\":42,\"channel_id\":[7,\"Ops\"],\"channel_member_id\":[12,\"m\"],"
                        + "\"partner_id\":[99,\"Alex\"],\"is_muted\":true,\"is_camera_on\":false,"
                        + "\"is_screen_sharing_on\":false}]"));

        List<RegistryRecord> rows = backend.searchRtcSessions(7L, null);

        assertThat(rows).singleElement().satisfies(r -> {
            assertThat(r.getId()).isEqualTo(42L);
            assertThat(r.getConversationId()).isEqualTo(7L);
            assertThat(r.getMembershipId()).isEqualTo(12L);
            assertThat(r.getPartnerId()).isEqualTo(99L);
            assertThat(r.getPartnerName()).isEqualTo("Alex");
            assertThat(r.getFlags().getMuted()).isTrue();
        });
    }

    @Test
    @SuppressWarnings("unchecked")
    void partialFlagUpdateWritesOnlyGivenFields() throws Exception {
        when(client.executeKw(eq("discuss.channel.rtc.session"), eq("write"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("true"));

        backend.updateRtcSession(42, SessionFlags.builder().cameraOn(true).build());

        ArgumentCaptor<List<?>> args = ArgumentCaptor.forClass(List.class);
        verify(client).executeKw(eq("discuss.channel.rtc.session"), eq("write"), args.capture(), anyMap());
        assertThat((Map<String, Object>) args.getValue().get(1)).containsOnly(Map.entry("is_camera_on", true));
    }

    @Test
    @SuppressWarnings("unchecked")
    void messagesArePostedAsComments() throws Exception {
        when(client.executeKw(eq("discuss.channel"), eq("message_post"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("777"));

        long id = backend.postMessage(7, OutgoingMessage.comment("📞 Call ended by Alex"));

        ArgumentCaptor<Map<String, ?>> kwargs = ArgumentCaptor.forClass(Map.class);
        verify(client).executeKw(eq("discuss.channel"), eq("message_post"), anyList(), kwargs.capture());
        assertThat(id).isEqualTo(777L);
        assertThat((Map<String, Object>) kwargs.getValue())
                .containsEntry("body", "📞 Call ended by Alex")
                .containsEntry("message_type", "comment")
                .containsEntry("subtype_xmlid", "mail.mt_comment")
                .doesNotContainKey("subject");
    }

    @Test
    void messagesKeepRawAuthorShape() throws Exception {
        when(client.executeKw(eq("mail.message"), eq("search_read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[{\"id\":501,\"body\":\"<p>hi</p>\",\"author_id\":[99,\"Alex\"],"
                        + "\"message_type\":\"comment\",\"subject\":false,\"email_from\":\"\\\"Alex\\\" <a@x.io>\"}]"));

        List<ChatMessage> messages = backend.fetchMessagesAfter(7, 500, 50);

        ChatMessage m = messages.get(0);
        assertThat(m.getId()).isEqualTo(501L);
        assertThat(m.getConversationId()).isEqualTo(7L);
        assertThat(m.getAuthor()).isEqualTo(List.of(99L, "Alex"));
        assertThat(m.getSubject()).isNull();
        assertThat(DiscussMessages.displayName(m.getEmailFrom())).isEqualTo("Alex");
    }

    @Test
    void missingRecordReadsAsEmpty() throws Exception {
        when(client.executeKw(eq("discuss.channel.rtc.session"), eq("search_read"), anyList(), anyMap()))
                .thenReturn(mapper.readTree("[]"));

        Optional<RegistryRecord> r = backend.readRtcSession(42);

        assertThat(r).isEmpty();
    }

    @Test
    void emptyDeleteSkipsTheRoundTrip() {
        backend.deleteRtcSessions(List.of());

        verifyNoInteractions(client);
    }
}
