package com.rebenew.watchParty.syncserver.service;

import com.rebenew.watchParty.syncserver.core.RoomSessionManager;
import com.rebenew.watchParty.syncserver.error.RoomError;
import com.rebenew.watchParty.syncserver.error.RoomOperationException;
import com.rebenew.watchParty.syncserver.model.RoomMember;
import com.rebenew.watchParty.syncserver.model.ServerEvent;
import com.rebenew.watchParty.syncserver.model.SignalKind;
import com.rebenew.watchParty.syncserver.model.SyncMsg;
import com.rebenew.watchParty.syncserver.model.SyncPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reenvío de chat y señalización de llamadas. Aquí no cambia el estado de la sala.
 */
@Service
public class RelayService {
    private static final Logger logger = LoggerFactory.getLogger(RelayService.class);

    private final RoomSessionManager roomSessionManager;

    public RelayService(RoomSessionManager roomSessionManager) {
        this.roomSessionManager = roomSessionManager;
    }

    public void sendChat(String roomCode, String userId, String message) {
        roomSessionManager.withMember(roomCode, userId, room -> {
            // el nombre sale de la sala, nunca de la petición
            RoomMember sender = room.findMember(userId).orElseThrow();
            SyncPayloads.ChatMessage chat = new SyncPayloads.ChatMessage(
                    sender.displayName(), message, roomSessionManager.currentTimestamp());
            roomSessionManager.publish(room, ServerEvent.NEW_CHAT, chat);
            logger.debug("💬 Chat in room {} from {}", roomCode, sender.displayName());
        });
    }

    /**
     * Reenvía un payload de señalización opaco a un miembro de la misma sala, marcado con el id
     * del emisor para que pueda responder.
     */
    public void relaySignal(SignalKind kind, String roomCode, String userId, String targetId, Object payload) {
        roomSessionManager.withMember(roomCode, userId, room -> {
            if (!room.isMember(targetId)) {
                logger.warn("Signal {} from {} to {} rejected: target not in room {}",
                        kind.event().wireName(), userId, targetId, roomCode);
                throw new RoomOperationException(RoomError.NOT_A_MEMBER, "El destinatario no es miembro de la sala " + roomCode);
            }
            Map<String, Object> data = new LinkedHashMap<>();
            data.put(kind.payloadField(), payload);
            data.put("fromId", userId);
            data.put("roomCode", roomCode);
            roomSessionManager.sendTo(targetId, SyncMsg.of(kind.event(), roomCode, data));
            logger.debug("📡 {} relayed in room {} from {} to {}", kind.event().wireName(), roomCode, userId, targetId);
        });
    }
}
