package com.rebenew.watchParty.syncserver.model;

import com.rebenew.watchParty.syncserver.error.InvalidMessageException;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Operaciones entrantes que acepta el gateway, cada una con los campos de data imprescindibles.
 * Cualquier otra cosa se rechaza antes de llegar a la sala.
 */
public enum ClientAction {
    CREATE_ROOM("create-room", false, "displayName"),
    JOIN_ROOM("join-room", true, "displayName"),
    LEAVE_ROOM("leave-room", true),
    LOAD_MEDIA("load-media", true, "media"),
    PLAY("play", true, "currentTime"),
    PAUSE("pause", true),
    SEEK("seek", true, "newTime"),
    NEXT_VIDEO("next-video", true),
    PREV_VIDEO("prev-video", true),
    SEND_CHAT("send-chat", true, "message"),
    VOICE_OFFER("voice-offer", true, "targetId", "offer"),
    VOICE_ANSWER("voice-answer", true, "targetId", "answer"),
    ICE_CANDIDATE("ice-candidate", true, "targetId", "candidate");

    private final String wireName;
    private final boolean requiresRoom;
    private final List<String> requiredFields;

    ClientAction(String wireName, boolean requiresRoom, String... requiredFields) {
        this.wireName = wireName;
        this.requiresRoom = requiresRoom;
        this.requiredFields = List.of(requiredFields);
    }

    public static Optional<ClientAction> fromWireName(String wireName) {
        if (wireName == null)
            return Optional.empty();
        return Arrays.stream(values())
                .filter(a -> a.wireName.equals(wireName))
                .findFirst();
    }

    /**
     * Comprueba que vengan el código de sala y todos los campos de data obligatorios.
     * Rangos y longitudes los valida el gateway.
     */
    public void validate(SyncMsg msg) {
        if (requiresRoom && (msg.getRoomCode() == null || msg.getRoomCode().trim().isEmpty())) {
            throw new InvalidMessageException(wireName + " requiere roomCode");
        }
        for (String field : requiredFields) {
            if (!msg.hasData(field)) {
                throw new InvalidMessageException(wireName + " requiere data." + field);
            }
        }
    }

    public String wireName() {
        return wireName;
    }

    public boolean requiresRoom() {
        return requiresRoom;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }
}
