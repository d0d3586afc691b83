package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.model.ServerEvent;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.model.SyncPayloads;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketRoomBroadcasterTest {

    private WebSocketRoomBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        broadcaster = new WebSocketRoomBroadcaster(new ObjectMapper());
    }

    @Test
    void publishSkipsExcludedConnection() throws Exception {
        List<String> toA = new ArrayList<>();
        List<String> toB = new ArrayList<>();
        broadcaster.register(session("a", toA));
        broadcaster.register(session("b", toB));
        broadcaster.subscribe("ROOM", "a");
        broadcaster.subscribe("ROOM", "b");

        broadcaster.publish("ROOM", SyncMsg.of(ServerEvent.USER_LEFT, "ROOM", new SyncPayloads.UserLeft("x")), "a");

        assertThat(toA).isEmpty();
        assertThat(toB).hasSize(1);
        assertThat(toB.get(0)).contains("\"event\":\"user-left\"");
    }

    @Test
    void failedSendDoesNotStopFanOut() throws Exception {
        WebSocketSession broken = mock(WebSocketSession.class);
        when(broken.getId()).thenReturn("broken");
        when(broken.isOpen()).thenReturn(true);
        doThrow(new IOException("reset")).when(broken).sendMessage(any());
        List<String> toOk = new ArrayList<>();

        broadcaster.register(broken);
        broadcaster.register(session("ok", toOk));
        broadcaster.subscribe("ROOM", "broken");
        broadcaster.subscribe("ROOM", "ok");

        broadcaster.publish("ROOM", SyncMsg.of(ServerEvent.SYNC_PAUSE, "ROOM", new SyncPayloads.SyncPause(1L)));

        assertThat(toOk).hasSize(1);
    }

    @Test
    void closedSessionIsSkipped() throws Exception {
        WebSocketSession closed = mock(WebSocketSession.class);
        when(closed.getId()).thenReturn("closed");
        when(closed.isOpen()).thenReturn(false);
        broadcaster.register(closed);

        broadcaster.sendTo("closed", SyncMsg.of(ServerEvent.SYNC_PAUSE, "ROOM", new SyncPayloads.SyncPause(1L)));

        verify(closed, never()).sendMessage(any());
    }

    @Test
    void unregisterDropsAllMemberships() throws Exception {
        broadcaster.register(session("a", new ArrayList<>()));
        broadcaster.subscribe("R1", "a");
        broadcaster.subscribe("R2", "a");
        assertThat(broadcaster.roomsOf("a")).containsExactlyInAnyOrder("R1", "R2");

        broadcaster.unregister("a");

        assertThat(broadcaster.roomsOf("a")).isEmpty();
        assertThat(broadcaster.subscribersOf("R1")).isEmpty();
        assertThat(broadcaster.subscribersOf("R2")).isEmpty();
        assertThat(broadcaster.getConnectionCount()).isZero();
    }

    @Test
    void subscribeIsRefusedOnceMarkedClosed() throws Exception {
        broadcaster.register(session("a", new ArrayList<>()));
        assertThat(broadcaster.subscribe("R1", "a")).isTrue();

        broadcaster.markClosed("a");

        assertThat(broadcaster.subscribe("R2", "a")).isFalse();
        assertThat(broadcaster.subscribe("R2", "never-registered")).isFalse();
        // existing groups survive until unregister so the disconnect can walk them
        assertThat(broadcaster.roomsOf("a")).containsExactly("R1");
        assertThat(broadcaster.subscribersOf("R2")).isEmpty();

        broadcaster.unregister("a");
        assertThat(broadcaster.roomsOf("a")).isEmpty();
    }

    @Test
    void unsubscribeLeavesOtherRooms() throws Exception {
        broadcaster.register(session("a", new ArrayList<>()));
        broadcaster.subscribe("R1", "a");
        broadcaster.subscribe("R2", "a");

        broadcaster.unsubscribe("R1", "a");

        assertThat(broadcaster.roomsOf("a")).containsExactly("R2");
        assertThat(broadcaster.subscribersOf("R1")).isEmpty();
    }

    @Test
    void sendToUnknownConnectionIsDropped() {
        broadcaster.sendTo("nobody", SyncMsg.of(ServerEvent.SYNC_PAUSE, "ROOM", new SyncPayloads.SyncPause(1L)));

        assertThat(broadcaster.getConnectionCount()).isZero();
    }

    private static WebSocketSession session(String id, List<String> outbox) throws IOException {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.getId()).thenReturn(id);
        when(session.isOpen()).thenReturn(true);
        doAnswer(inv -> {
            outbox.add(((TextMessage) inv.getArgument(0)).getPayload());
            return null;
        }).when(session).sendMessage(any());
        return session;
    }
}
