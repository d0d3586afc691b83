package com.rebenew.watchParty.syncserver.websocket;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.config.WatchPartyProperties;
import com.rebenew.watchParty.syncserver.core.RoomSessionManager;
import com.rebenew.watchParty.syncserver.error.InvalidMessageException;
import com.rebenew.watchParty.syncserver.error.RoomCodeExhaustedException;
import com.rebenew.watchParty.syncserver.error.RoomError;
import com.rebenew.watchParty.syncserver.error.RoomOperationException;
import com.rebenew.watchParty.syncserver.model.*;
import com.rebenew.watchParty.syncserver.service.PlaybackService;
import com.rebenew.watchParty.syncserver.service.RelayService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.util.Locale;

/**
 * Puente entre los frames WebSocket y los servicios de sala. Cada frame es un {@link SyncMsg};
 * la identidad del emisor es siempre el id de la sesión de transporte, nunca lo que diga el cliente.
 * Los rechazos vuelven solo al emisor, como evento {@code error} con el correlationId original.
 */
@Component
public class SyncWebSocketHandler extends TextWebSocketHandler {
    private static final Logger logger = LoggerFactory.getLogger(SyncWebSocketHandler.class);

    private final RoomSessionManager sessionManager;
    private final PlaybackService playbackService;
    private final RelayService relayService;
    private final WebSocketRoomBroadcaster broadcaster;
    private final ObjectMapper objectMapper;
    private final WatchPartyProperties.Rooms limits;

    public SyncWebSocketHandler(RoomSessionManager sessionManager, PlaybackService playbackService,
                                RelayService relayService, WebSocketRoomBroadcaster broadcaster,
                                ObjectMapper objectMapper, WatchPartyProperties properties) {
        this.sessionManager = sessionManager;
        this.playbackService = playbackService;
        this.relayService = relayService;
        this.broadcaster = broadcaster;
        this.objectMapper = objectMapper;
        this.limits = properties.getRooms();
        logger.info("✅ SyncWebSocketHandler inicializado");
    }

    // ==================== CICLO DE VIDA WEBSOCKET ====================

    @Override
    public void afterConnectionEstablished(@NonNull WebSocketSession session) {
        broadcaster.register(session);
        logger.info("🔄 Nueva conexión WebSocket: {}", session.getId());
    }

    @Override
    protected void handleTextMessage(@NonNull WebSocketSession session, @NonNull TextMessage message) {
        SyncMsg msg;
        try {
            msg = objectMapper.readValue(message.getPayload(), SyncMsg.class);
        } catch (JsonProcessingException e) {
            logger.warn("❌ Frame ilegible de {}: {}", session.getId(), e.getOriginalMessage());
            reject(session.getId(), RoomError.INVALID_REQUEST, "Mensaje mal formado", null, null);
            return;
        }
        processMessage(session.getId(), msg);
    }

    @Override
    public void afterConnectionClosed(@NonNull WebSocketSession session, @NonNull CloseStatus status) {
        String connectionId = session.getId();
        // primero cerrar: un frame aún en curso ya no puede suscribir esta conexión a ninguna sala
        broadcaster.markClosed(connectionId);
        try {
            sessionManager.disconnect(connectionId);
        } finally {
            broadcaster.unregister(connectionId);
        }
        logger.info("🔌 Conexión cerrada: {} ({})", connectionId, status);
    }

    @Override
    public void handleTransportError(@NonNull WebSocketSession session, @NonNull Throwable exception) {
        logger.error("🚨 Error de transporte WebSocket: {} - {}", session.getId(), exception.getMessage());
    }

    // ==================== DESPACHO ====================

    void processMessage(String connectionId, SyncMsg msg) {
        String correlationId = msg.getCorrelationId();
        String roomCode = normalizeRoomCode(msg.getRoomCode());

        ClientAction action = ClientAction.fromWireName(msg.getEvent()).orElse(null);
        if (action == null) {
            logger.warn("❓ Evento desconocido '{}' de {}", msg.getEvent(), connectionId);
            reject(connectionId, RoomError.INVALID_REQUEST, "Evento desconocido: " + msg.getEvent(), roomCode, correlationId);
            return;
        }

        try {
            action.validate(msg);
            switch (action) {
                case CREATE_ROOM:
                    sessionManager.createRoom(connectionId, requireDisplayName(msg));
                    break;
                case JOIN_ROOM:
                    sessionManager.joinRoom(roomCode, connectionId, requireDisplayName(msg));
                    break;
                case LEAVE_ROOM:
                    sessionManager.leaveRoom(roomCode, connectionId);
                    break;
                case LOAD_MEDIA:
                    playbackService.loadMedia(roomCode, connectionId, requireMedia(msg),
                            msg.getBoolData("addToQueue", false));
                    break;
                case PLAY:
                    playbackService.play(roomCode, connectionId, requireTime(msg, "currentTime"));
                    break;
                case PAUSE:
                    playbackService.pause(roomCode, connectionId);
                    break;
                case SEEK:
                    playbackService.seek(roomCode, connectionId, requireTime(msg, "newTime"));
                    break;
                case NEXT_VIDEO:
                    playbackService.nextVideo(roomCode, connectionId);
                    break;
                case PREV_VIDEO:
                    playbackService.previousVideo(roomCode, connectionId);
                    break;
                case SEND_CHAT:
                    relayService.sendChat(roomCode, connectionId, requireChatMessage(msg));
                    break;
                case VOICE_OFFER:
                    relaySignal(SignalKind.VOICE_OFFER, roomCode, connectionId, msg);
                    break;
                case VOICE_ANSWER:
                    relaySignal(SignalKind.VOICE_ANSWER, roomCode, connectionId, msg);
                    break;
                case ICE_CANDIDATE:
                    relaySignal(SignalKind.ICE_CANDIDATE, roomCode, connectionId, msg);
                    break;
                default:
                    reject(connectionId, RoomError.INVALID_REQUEST, "Evento no soportado", roomCode, correlationId);
            }
        } catch (RoomOperationException e) {
            if (e.getError() == RoomError.CONNECTION_CLOSED) {
                // no hay a quién responder
                logger.info("🔌 {} de {} descartado: la conexión ya se cerró", action.wireName(), connectionId);
                return;
            }
            logger.warn("⛔ {} de {} rechazado: {} ({})", action.wireName(), connectionId, e.getError().code(), e.getMessage());
            reject(connectionId, e.getError(), e.getMessage(), roomCode, correlationId);
        } catch (InvalidMessageException | IllegalArgumentException e) {
            logger.warn("❌ {} inválido de {}: {}", action.wireName(), connectionId, e.getMessage());
            reject(connectionId, RoomError.INVALID_REQUEST, e.getMessage(), roomCode, correlationId);
        } catch (RoomCodeExhaustedException e) {
            logger.error("🚨 No se pudo asignar código de sala a {}: {}", connectionId, e.getMessage());
            reject(connectionId, RoomError.INTERNAL_ERROR, "No se pudo crear la sala", roomCode, correlationId);
        } catch (RuntimeException e) {
            logger.error("❌ Error procesando {} de {}: {}", action.wireName(), connectionId, e.getMessage(), e);
            reject(connectionId, RoomError.INTERNAL_ERROR, "Error interno", roomCode, correlationId);
        }
    }

    private void relaySignal(SignalKind kind, String roomCode, String connectionId, SyncMsg msg) {
        String targetId = msg.getStringData("targetId");
        if (targetId == null || targetId.isBlank())
            throw new InvalidMessageException("targetId debe ser un texto no vacío");
        relayService.relaySignal(kind, roomCode, connectionId, targetId, msg.getRawData(kind.payloadField()));
    }

    private void reject(String connectionId, RoomError error, String message, String roomCode, String correlationId) {
        broadcaster.sendTo(connectionId, SyncMsg.error(error, message, roomCode, correlationId));
    }

    // ==================== VALIDACIÓN ====================

    static String normalizeRoomCode(String roomCode) {
        if (roomCode == null)
            return null;
        return roomCode.trim().toUpperCase(Locale.ROOT);
    }

    private String requireDisplayName(SyncMsg msg) {
        String name = msg.getStringData("displayName");
        if (name == null || name.trim().isEmpty())
            throw new InvalidMessageException("displayName debe ser un texto no vacío");
        name = name.trim();
        if (name.length() > limits.getMaxDisplayNameLength())
            throw new InvalidMessageException("displayName supera " + limits.getMaxDisplayNameLength() + " caracteres");
        return name;
    }

    private double requireTime(SyncMsg msg, String key) {
        Double time = msg.getDoubleData(key);
        if (time == null || time.isNaN() || time.isInfinite() || time < 0)
            throw new InvalidMessageException(key + " debe ser un número no negativo");
        return time;
    }

    private MediaRef requireMedia(SyncMsg msg) {
        Object raw = msg.getRawData("media");
        try {
            return objectMapper.convertValue(raw, MediaRef.class);
        } catch (IllegalArgumentException e) {
            throw new InvalidMessageException("media debe ser un objeto con type e id no vacíos");
        }
    }

    private String requireChatMessage(SyncMsg msg) {
        String text = msg.getStringData("message");
        if (text == null || text.isBlank())
            throw new InvalidMessageException("message debe ser un texto no vacío");
        if (text.length() > limits.getMaxChatLength())
            throw new InvalidMessageException("message supera " + limits.getMaxChatLength() + " caracteres");
        return text;
    }
}
