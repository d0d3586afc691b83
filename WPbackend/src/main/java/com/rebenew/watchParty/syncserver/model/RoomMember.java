package com.rebenew.watchParty.syncserver.model;

// Conexión y nombre con el que se unió a la sala.
public record RoomMember(String connectionId, String displayName) {
    public RoomMember {
        if (connectionId == null || connectionId.isEmpty()) {
            throw new IllegalArgumentException("connectionId no puede estar vacío");
        }
    }
}
