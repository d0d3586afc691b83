package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.error.RoomError;
import com.rebenew.watchParty.syncserver.error.RoomOperationException;
import com.rebenew.watchParty.syncserver.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

// Ciclo de vida de salas, miembros y autoridad del host. Room es la única fuente de verdad.

@Service
public class RoomSessionManager {
    private static final Logger logger = LoggerFactory.getLogger(RoomSessionManager.class);

    private final RoomStore roomStore;
    private final RoomBroadcaster broadcaster;
    private final Clock clock;

    public RoomSessionManager(RoomStore roomStore, RoomBroadcaster broadcaster, Clock clock) {
        this.roomStore = roomStore;
        this.broadcaster = broadcaster;
        this.clock = clock;
        logger.info("RoomSessionManager inicializado");
    }

    // ====================
    // CREACIÓN DE SALAS
    // ====================

    public Room createRoom(String connectionId, String displayName) {
        Room room = roomStore.create(connectionId, displayName);
        String roomCode = room.getRoomCode();
        synchronized (room) {
            if (!broadcaster.subscribe(roomCode, connectionId)) {
                // el creador se desconectó antes de terminar: la sala no debe quedar viva
                room.close();
                roomStore.delete(roomCode);
                logger.warn("Sala {} descartada: conexión {} ya cerrada", roomCode, connectionId);
                throw connectionClosed(connectionId);
            }
            broadcaster.sendTo(connectionId,
                    SyncMsg.of(ServerEvent.ROOM_CREATED, roomCode, new SyncPayloads.RoomCreated(roomCode)));
        }
        logger.info("🎬 Sala creada: {} por {} ({})", roomCode, displayName, connectionId);
        return room;
    }

    // ====================
    // MIEMBROS
    // ====================

    /**
     * Añade al llamante a la sala, avisa a los miembros existentes y le envía un snapshot completo.
     * Un llamante que ya es miembro solo recibe el snapshot de nuevo.
     */
    public SyncPayloads.RoomSnapshot joinRoom(String roomCode, String connectionId, String displayName) {
        Room room = requireRoom(roomCode);
        synchronized (room) {
            ensureOpen(room);
            // suscribir antes de añadir: una conexión cerrada nunca llega a ser miembro
            if (!broadcaster.subscribe(roomCode, connectionId)) {
                logger.warn("Intento de unirse a sala {} desde conexión cerrada {}", roomCode, connectionId);
                throw connectionClosed(connectionId);
            }
            boolean added = room.addMember(new RoomMember(connectionId, displayName));
            if (added) {
                broadcaster.publish(roomCode,
                        SyncMsg.of(ServerEvent.USER_JOINED, roomCode, new SyncPayloads.UserJoined(connectionId, displayName)),
                        connectionId);
                logger.info("👤 {} unido a sala {} ({} miembros)", displayName, roomCode, room.getMemberCount());
            } else {
                logger.debug("{} se volvió a unir a {}; reenviando snapshot", connectionId, roomCode);
            }

            SyncPayloads.RoomSnapshot snapshot = room.snapshot();
            broadcaster.sendTo(connectionId, SyncMsg.of(ServerEvent.ROOM_STATE, roomCode, snapshot));
            return snapshot;
        }
    }

    public void leaveRoom(String roomCode, String connectionId) {
        Room room = requireRoom(roomCode);
        synchronized (room) {
            ensureOpen(room);
            if (!room.isMember(connectionId)) {
                throw new RoomOperationException(RoomError.NOT_A_MEMBER,
                        "No eres miembro de la sala " + roomCode);
            }
            depart(room, connectionId);
        }
    }

    /**
     * Saca una conexión cerrada de todas las salas a cuyo grupo estaba suscrita.
     * El transporte debe haberla marcado como cerrada antes, para que no entre en salas nuevas.
     */
    public void disconnect(String connectionId) {
        for (String roomCode : broadcaster.roomsOf(connectionId)) {
            Optional<Room> found = roomStore.find(roomCode);
            if (found.isEmpty()) {
                broadcaster.unsubscribe(roomCode, connectionId);
                continue;
            }
            Room room = found.get();
            synchronized (room) {
                if (room.isClosed()) {
                    broadcaster.unsubscribe(roomCode, connectionId);
                    continue;
                }
                depart(room, connectionId);
            }
        }
        logger.info("🔌 Conexión {} desconectada", connectionId);
    }

    // El llamante tiene el monitor de la sala.
    private void depart(Room room, String connectionId) {
        String roomCode = room.getRoomCode();
        Room.Departure departure = room.removeMember(connectionId);
        broadcaster.unsubscribe(roomCode, connectionId);
        if (!departure.removed())
            return;

        if (departure.empty()) {
            room.close();
            roomStore.delete(roomCode);
            logger.info("🗑️ Sala eliminada: {} (salió el último miembro {})", roomCode, connectionId);
            return;
        }

        broadcaster.publish(roomCode,
                SyncMsg.of(ServerEvent.USER_LEFT, roomCode, new SyncPayloads.UserLeft(connectionId)));
        logger.info("👋 {} salió de {} (quedan {} miembros)", connectionId, roomCode, room.getMemberCount());

        if (departure.promotedHostId() != null) {
            broadcaster.publish(roomCode,
                    SyncMsg.of(ServerEvent.HOST_CHANGED, roomCode,
                            new SyncPayloads.HostChanged(departure.promotedHostId())));
            logger.info("👑 Host de {} pasa de {} a {}", roomCode, connectionId, departure.promotedHostId());
        }
    }

    // ====================
    // AUTORIDAD
    // ====================

    /**
     * Ejecuta {@code action} bajo el lock de la sala tras comprobar que el llamante es miembro.
     */
    public void withMember(String roomCode, String callerId, Consumer<Room> action) {
        Room room = requireRoom(roomCode);
        synchronized (room) {
            ensureOpen(room);
            requireMember(room, callerId);
            action.accept(room);
        }
    }

    /**
     * Ejecuta {@code action} bajo el lock de la sala tras comprobar que el llamante es el host.
     * La autoridad se lee de la sala en cada llamada, así que una promoción vale desde el siguiente comando.
     */
    public void withHost(String roomCode, String callerId, Consumer<Room> action) {
        Room room = requireRoom(roomCode);
        synchronized (room) {
            ensureOpen(room);
            requireMember(room, callerId);
            if (!room.isHost(callerId)) {
                logger.warn("Usuario {} sin permisos de host en sala: {}", callerId, roomCode);
                throw new RoomOperationException(RoomError.NOT_HOST, "Solo el host puede hacer eso");
            }
            action.accept(room);
        }
    }

    private Room requireRoom(String roomCode) {
        return roomStore.find(roomCode)
                .orElseThrow(() -> {
                    logger.warn("Intento de usar sala inexistente: {}", roomCode);
                    return new RoomOperationException(RoomError.ROOM_NOT_FOUND, "Sala no encontrada");
                });
    }

    // Una sala resuelta justo antes de que saliera su último miembro ya no existe.
    private void ensureOpen(Room room) {
        if (room.isClosed())
            throw new RoomOperationException(RoomError.ROOM_NOT_FOUND, "Sala no encontrada");
    }

    private void requireMember(Room room, String callerId) {
        if (!room.isMember(callerId)) {
            logger.warn("Usuario {} no es miembro de la sala {}", callerId, room.getRoomCode());
            throw new RoomOperationException(RoomError.NOT_A_MEMBER, "No eres miembro de la sala " + room.getRoomCode());
        }
    }

    private static RoomOperationException connectionClosed(String connectionId) {
        return new RoomOperationException(RoomError.CONNECTION_CLOSED, "Conexión cerrada: " + connectionId);
    }

    // ====================
    // DIFUSIÓN
    // ====================

    public void publish(Room room, ServerEvent event, Object payload) {
        broadcaster.publish(room.getRoomCode(), SyncMsg.of(event, room.getRoomCode(), payload));
        logger.debug("📢 {} difundido a sala {}", event.wireName(), room.getRoomCode());
    }

    public void sendTo(String connectionId, SyncMsg message) {
        broadcaster.sendTo(connectionId, message);
    }

    // Hora de envío del servidor que llevan los eventos de sync.
    public long currentTimestamp() {
        return clock.millis();
    }

    // ====================
    // CONSULTAS
    // ====================

    public boolean roomExists(String roomCode) {
        return roomStore.exists(roomCode);
    }

    public List<String> activeRoomCodes() {
        return roomStore.roomCodes();
    }

    public Optional<Room> findRoom(String roomCode) {
        return roomStore.find(roomCode);
    }
}
