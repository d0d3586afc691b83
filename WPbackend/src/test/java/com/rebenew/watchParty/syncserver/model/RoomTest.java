package com.rebenew.watchParty.syncserver.model;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RoomTest {

    private static final MediaRef ONE = new MediaRef("youtube", "one");
    private static final MediaRef TWO = new MediaRef("youtube", "two");

    private Room room;

    @BeforeEach
    void setUp() {
        room = new Room("ABC123", new RoomMember("h", "Host"), Instant.parse("2025-01-01T00:00:00Z"));
    }

    @Test
    void newRoomIsIdle() {
        SyncPayloads.RoomSnapshot snapshot = room.snapshot();

        assertThat(snapshot.media()).isNull();
        assertThat(snapshot.queue()).isEmpty();
        assertThat(snapshot.currentIndex()).isZero();
        assertThat(snapshot.isPlaying()).isFalse();
        assertThat(snapshot.currentTime()).isZero();
        assertThat(snapshot.hostId()).isEqualTo("h");
        assertThat(snapshot.users()).containsExactly("Host");
    }

    @Test
    void duplicateMemberIsNotAddedTwice() {
        assertThat(room.addMember(new RoomMember("g", "Guest"))).isTrue();
        assertThat(room.addMember(new RoomMember("g", "Guest again"))).isFalse();

        assertThat(room.getMemberCount()).isEqualTo(2);
        assertThat(room.findMember("g")).map(RoomMember::displayName).contains("Guest");
    }

    @Test
    void removingHostPromotesFirstInJoinOrder() {
        room.addMember(new RoomMember("g1", "First"));
        room.addMember(new RoomMember("g2", "Second"));

        Room.Departure departure = room.removeMember("h");

        assertThat(departure).isEqualTo(new Room.Departure(true, "g1", false));
        assertThat(room.isHost("g1")).isTrue();
        assertThat(room.isHost("h")).isFalse();
    }

    @Test
    void removingGuestPromotesNobody() {
        room.addMember(new RoomMember("g1", "First"));

        assertThat(room.removeMember("g1")).isEqualTo(new Room.Departure(true, null, false));
        assertThat(room.getHostId()).isEqualTo("h");
    }

    @Test
    void removingLastMemberReportsEmpty() {
        assertThat(room.removeMember("h")).isEqualTo(new Room.Departure(true, null, true));
        assertThat(room.removeMember("h").removed()).isFalse();
    }

    @Test
    void replacingLoadResetsQueueButKeepsPlaybackFields() {
        room.loadMedia(ONE, false);
        room.loadMedia(TWO, true);
        room.play(40.0);

        room.loadMedia(TWO, false);

        assertThat(room.getQueue()).containsExactly(TWO);
        assertThat(room.getMedia()).isEqualTo(TWO);
        assertThat(room.getCurrentIndex()).isZero();
        assertThat(room.isPlaying()).isTrue();
        assertThat(room.getCurrentTime()).isEqualTo(40.0);
    }

    @Test
    void stepWrapsBothWays() {
        room.loadMedia(ONE, false);
        room.loadMedia(TWO, true);

        assertThat(room.step(1)).isEqualTo(TWO);
        assertThat(room.step(1)).isEqualTo(ONE);
        assertThat(room.step(-1)).isEqualTo(TWO);
        assertThat(room.getCurrentIndex()).isEqualTo(1);
    }

    @Test
    void stepOnSingleItemStaysPut() {
        room.loadMedia(ONE, false);
        room.play(10.0);

        assertThat(room.step(-1)).isEqualTo(ONE);
        assertThat(room.getCurrentIndex()).isZero();
        assertThat(room.getCurrentTime()).isZero();
        assertThat(room.isPlaying()).isFalse();
    }

    @Test
    void stepOnEmptyQueueFails() {
        assertThatThrownBy(() -> room.step(1)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void seekDoesNotChangePlayingFlag() {
        room.seek(12.0);

        assertThat(room.isPlaying()).isFalse();
        assertThat(room.getCurrentTime()).isEqualTo(12.0);
    }

    @Test
    void roomResponseReflectsClosedFlag() {
        room.loadMedia(ONE, true);
        assertThat(room.toRoomResponse().isExists()).isTrue();
        assertThat(room.toRoomResponse().getQueueSize()).isEqualTo(1);
        assertThat(room.toRoomResponse().getCreatedAt()).isEqualTo("2025-01-01T00:00:00Z");

        room.close();

        assertThat(room.toRoomResponse().isExists()).isFalse();
    }

    @Test
    void mediaRefRejectsBlankFields() {
        assertThatThrownBy(() -> new MediaRef(" ", "id")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new MediaRef("youtube", null)).isInstanceOf(IllegalArgumentException.class);
    }
}
