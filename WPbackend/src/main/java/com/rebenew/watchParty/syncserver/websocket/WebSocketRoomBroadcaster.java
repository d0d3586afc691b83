package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.RoomBroadcaster;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * {@link RoomBroadcaster} sobre sesiones WebSocket de Spring.
 * Guarda las sesiones abiertas por id y los grupos de sala a los que está suscrita cada una.
 */
@Component
public class WebSocketRoomBroadcaster implements RoomBroadcaster {
    private static final Logger logger = LoggerFactory.getLogger(WebSocketRoomBroadcaster.class);

    private final ObjectMapper objectMapper;

    private final ConcurrentMap<String, WebSocketSession> connections = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> roomMembers = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> connectionRooms = new ConcurrentHashMap<>();

    public WebSocketRoomBroadcaster(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ==================== CONEXIONES ====================

    public void register(WebSocketSession session) {
        connections.put(session.getId(), session);
    }

    /**
     * Marca la conexión como cerrada: a partir de aquí {@link #subscribe} la rechaza.
     * Sus grupos se conservan para que la salida de cada sala pueda recorrerlos.
     */
    public void markClosed(String connectionId) {
        connections.remove(connectionId);
    }

    /**
     * Olvida la conexión y cualquier grupo al que siga perteneciendo.
     */
    public void unregister(String connectionId) {
        connections.remove(connectionId);
        Set<String> rooms = connectionRooms.remove(connectionId);
        if (rooms != null) {
            rooms.forEach(roomCode -> removeFromGroup(roomCode, connectionId));
        }
    }

    public int getConnectionCount() {
        return connections.size();
    }

    // ==================== GRUPOS ====================

    @Override
    public boolean subscribe(String roomCode, String connectionId) {
        // atómico respecto a markClosed/unregister: ambos quitan la misma clave
        WebSocketSession session = connections.computeIfPresent(connectionId, (id, open) -> {
            roomMembers.computeIfAbsent(roomCode, k -> ConcurrentHashMap.newKeySet()).add(id);
            connectionRooms.computeIfAbsent(id, k -> ConcurrentHashMap.newKeySet()).add(roomCode);
            return open;
        });
        if (session == null) {
            logger.debug("Suscripción rechazada: conexión {} cerrada (sala {})", connectionId, roomCode);
            return false;
        }
        return true;
    }

    @Override
    public void unsubscribe(String roomCode, String connectionId) {
        removeFromGroup(roomCode, connectionId);
        connectionRooms.computeIfPresent(connectionId, (k, rooms) -> {
            rooms.remove(roomCode);
            return rooms.isEmpty() ? null : rooms;
        });
    }

    @Override
    public Set<String> roomsOf(String connectionId) {
        Set<String> rooms = connectionRooms.get(connectionId);
        return rooms == null ? Set.of() : Set.copyOf(rooms);
    }

    public Set<String> subscribersOf(String roomCode) {
        Set<String> members = roomMembers.get(roomCode);
        return members == null ? Set.of() : Set.copyOf(members);
    }

    private void removeFromGroup(String roomCode, String connectionId) {
        roomMembers.computeIfPresent(roomCode, (k, members) -> {
            members.remove(connectionId);
            return members.isEmpty() ? null : members;
        });
    }

    // ==================== ENTREGA ====================

    @Override
    public void publish(String roomCode, SyncMsg message, String excludeConnectionId) {
        Set<String> members = roomMembers.get(roomCode);
        if (members == null || members.isEmpty())
            return;

        String json = serialize(message);
        if (json == null)
            return;

        for (String connectionId : members) {
            if (connectionId.equals(excludeConnectionId))
                continue;
            safeSend(connections.get(connectionId), json);
        }
        logger.debug("📢 {} entregado a sala {} (excluido: {})", message.getEvent(), roomCode, excludeConnectionId);
    }

    @Override
    public void sendTo(String connectionId, SyncMsg message) {
        WebSocketSession session = connections.get(connectionId);
        if (session == null) {
            logger.debug("Descartando {} para conexión desconocida {}", message.getEvent(), connectionId);
            return;
        }
        String json = serialize(message);
        if (json != null)
            safeSend(session, json);
    }

    // WebSocketSession.sendMessage no es thread-safe: un solo escritor por sesión.
    private void safeSend(WebSocketSession session, String json) {
        if (session == null)
            return;
        try {
            if (!session.isOpen())
                return;
            synchronized (session) {
                session.sendMessage(new TextMessage(json));
            }
        } catch (IOException | IllegalStateException e) {
            logger.warn("⚠️ No se pudo entregar mensaje a sesión {}: {}", session.getId(), e.getMessage());
        }
    }

    private String serialize(SyncMsg message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            logger.error("❌ No se pudo serializar {}: {}", message, e.getMessage(), e);
            return null;
        }
    }
}
