package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Payloads del campo {@code data} de los {@link SyncMsg} salientes.
 * Un record por evento del servidor, con un conjunto fijo de campos.
 */
public final class SyncPayloads {

    private SyncPayloads() {
    }

    public record RoomCreated(String roomCode) {
    }

    /**
     * Estado completo de la sala que recibe una conexión al unirse; no necesita reproducir el historial.
     */
    public record RoomSnapshot(
            MediaRef media,
            List<MediaRef> queue,
            int currentIndex,
            @JsonProperty("isPlaying") boolean isPlaying,
            double currentTime,
            String hostId,
            List<String> users) {
    }

    public record UserJoined(String id, String name) {
    }

    public record UserLeft(String id) {
    }

    public record HostChanged(String hostId) {
    }

    public record MediaUpdate(MediaRef media, List<MediaRef> queue, int currentIndex) {
    }

    // timestamp: epoch millis del servidor al autorizar; los clientes lo usan para compensar el retardo
    public record SyncPlay(double currentTime, long timestamp) {
    }

    public record SyncPause(long timestamp) {
    }

    public record SyncSeek(double newTime, long timestamp) {
    }

    public record ChatMessage(String user, String message, long timestamp) {
    }

    public record ErrorNotice(String code, String msg) {
    }
}
