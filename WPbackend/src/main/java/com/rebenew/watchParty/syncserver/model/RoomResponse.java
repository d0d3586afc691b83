package com.rebenew.watchParty.syncserver.model;

import lombok.Getter;

/**
 * Resumen de solo lectura de una sala para la API HTTP.
 */
@Getter
public class RoomResponse {
    private final String roomCode;
    private final boolean exists;
    private final int memberCount;
    private final int queueSize;
    private final String createdAt;

    public RoomResponse(String roomCode, boolean exists, int memberCount, int queueSize, String createdAt) {
        this.roomCode = roomCode;
        this.exists = exists;
        this.memberCount = memberCount;
        this.queueSize = queueSize;
        this.createdAt = createdAt;
    }
}
