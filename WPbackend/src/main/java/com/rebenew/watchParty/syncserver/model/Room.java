package com.rebenew.watchParty.syncserver.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Estado autoritativo de una sala.
 *
 * Todos los métodos se sincronizan sobre la propia sala. Quien comprueba autoridad y luego
 * muta mantiene el mismo monitor durante toda la secuencia (ver RoomSessionManager): la sala
 * tiene un único escritor en cada momento.
 */
public class Room {
    // IDENTIFICACIÓN
    private final String roomCode;
    private final Instant createdAt;

    // AUTORIDAD
    private String hostId;

    // COLA Y REPRODUCCIÓN
    private final List<MediaRef> queue = new ArrayList<>();
    private int currentIndex = 0;
    private MediaRef media = null;
    private boolean playing = false;
    private double currentTime = 0.0;

    // MIEMBROS (orden de entrada)
    private final List<RoomMember> users = new ArrayList<>();

    private boolean closed = false;

    public Room(String roomCode, RoomMember creator, Instant createdAt) {
        if (roomCode == null || roomCode.isEmpty()) {
            throw new IllegalArgumentException("roomCode no puede estar vacío");
        }
        this.roomCode = roomCode;
        this.createdAt = createdAt;
        this.users.add(creator);
        this.hostId = creator.connectionId();
    }

    // ========== MIEMBROS ==========

    /**
     * Añade el miembro al final, en orden de entrada.
     *
     * @return false si la conexión ya es miembro
     */
    public synchronized boolean addMember(RoomMember member) {
        if (isMember(member.connectionId()))
            return false;
        users.add(member);
        return true;
    }

    /**
     * Quita un miembro y, si era el host, promueve al miembro restante más antiguo.
     */
    public synchronized Departure removeMember(String connectionId) {
        boolean removed = users.removeIf(u -> u.connectionId().equals(connectionId));
        if (!removed)
            return new Departure(false, null, users.isEmpty());

        if (users.isEmpty()) {
            // la sala se va a borrar; se conserva el último host para los logs
            return new Departure(true, null, true);
        }

        String promoted = null;
        if (connectionId.equals(hostId)) {
            hostId = users.get(0).connectionId();
            promoted = hostId;
        }
        return new Departure(true, promoted, false);
    }

    public synchronized Optional<RoomMember> findMember(String connectionId) {
        return users.stream()
                .filter(u -> u.connectionId().equals(connectionId))
                .findFirst();
    }

    public synchronized boolean isMember(String connectionId) {
        return findMember(connectionId).isPresent();
    }

    public synchronized boolean isHost(String connectionId) {
        return hostId != null && hostId.equals(connectionId);
    }

    // ========== COLA ==========

    public synchronized void loadMedia(MediaRef ref, boolean addToQueue) {
        if (addToQueue) {
            queue.add(ref);
            return;
        }
        queue.clear();
        queue.add(ref);
        currentIndex = 0;
        media = ref;
    }

    /**
     * Mueve la posición de la cola {@code delta} pasos, dando la vuelta en ambos sentidos,
     * y rebobina al inicio del nuevo elemento.
     *
     * @throws IllegalStateException si la cola está vacía
     */
    public synchronized MediaRef step(int delta) {
        if (queue.isEmpty())
            throw new IllegalStateException("No se puede navegar una cola vacía en la sala " + roomCode);
        currentIndex = Math.floorMod(currentIndex + delta, queue.size());
        media = queue.get(currentIndex);
        currentTime = 0.0;
        playing = false;
        return media;
    }

    // ========== REPRODUCCIÓN ==========

    public synchronized void play(double currentTime) {
        this.playing = true;
        this.currentTime = currentTime;
    }

    public synchronized void pause() {
        this.playing = false;
    }

    public synchronized void seek(double newTime) {
        this.currentTime = newTime;
    }

    // ========== CICLO DE VIDA ==========

    public synchronized void close() {
        this.closed = true;
    }

    public synchronized boolean isClosed() {
        return closed;
    }

    // ========== VISTAS ==========

    public synchronized SyncPayloads.RoomSnapshot snapshot() {
        return new SyncPayloads.RoomSnapshot(
                media,
                List.copyOf(queue),
                currentIndex,
                playing,
                currentTime,
                hostId,
                users.stream().map(RoomMember::displayName).toList());
    }

    public synchronized SyncPayloads.MediaUpdate mediaUpdate() {
        return new SyncPayloads.MediaUpdate(media, List.copyOf(queue), currentIndex);
    }

    public RoomResponse toRoomResponse() {
        synchronized (this) {
            return new RoomResponse(roomCode, !closed, users.size(), queue.size(), createdAt.toString());
        }
    }

    // ========== GETTERS ==========

    public String getRoomCode() {
        return roomCode;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public synchronized String getHostId() {
        return hostId;
    }

    public synchronized List<MediaRef> getQueue() {
        return List.copyOf(queue);
    }

    public synchronized int getQueueSize() {
        return queue.size();
    }

    public synchronized int getCurrentIndex() {
        return currentIndex;
    }

    public synchronized MediaRef getMedia() {
        return media;
    }

    public synchronized boolean isPlaying() {
        return playing;
    }

    public synchronized double getCurrentTime() {
        return currentTime;
    }

    public synchronized List<RoomMember> getUsers() {
        return List.copyOf(users);
    }

    public synchronized int getMemberCount() {
        return users.size();
    }

    @Override
    public synchronized String toString() {
        return "Room{" +
                "roomCode='" + roomCode + '\'' +
                ", hostId='" + hostId + '\'' +
                ", members=" + users.size() +
                ", queueSize=" + queue.size() +
                ", currentIndex=" + currentIndex +
                ", playing=" + playing +
                ", currentTime=" + currentTime +
                ", closed=" + closed +
                '}';
    }

    /**
     * Resultado de {@link #removeMember(String)}.
     *
     * @param promotedHostId nuevo host si el miembro que sale tenía el rol; null en otro caso
     * @param empty          true si no quedan miembros
     */
    public record Departure(boolean removed, String promotedHostId, boolean empty) {
    }
}
