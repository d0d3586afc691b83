package com.rebenew.watchParty.syncserver.model;

// Nombres de los eventos salientes tal como viajan por el WebSocket.
public enum ServerEvent {
    ROOM_CREATED("room-created"),
    ROOM_STATE("room-state"),
    USER_JOINED("user-joined"),
    USER_LEFT("user-left"),
    HOST_CHANGED("host-changed"),
    MEDIA_UPDATED("media-updated"),
    SYNC_PLAY("sync-play"),
    SYNC_PAUSE("sync-pause"),
    SYNC_SEEK("sync-seek"),
    NEW_CHAT("new-chat"),
    VOICE_OFFER("voice-offer"),
    VOICE_ANSWER("voice-answer"),
    ICE_CANDIDATE("ice-candidate"),
    ERROR("error");

    private final String wireName;

    ServerEvent(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
