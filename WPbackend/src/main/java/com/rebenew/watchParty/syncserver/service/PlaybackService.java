package com.rebenew.watchParty.syncserver.service;

import com.rebenew.watchParty.syncserver.core.RoomSessionManager;
import com.rebenew.watchParty.syncserver.error.RoomError;
import com.rebenew.watchParty.syncserver.error.RoomOperationException;
import com.rebenew.watchParty.syncserver.model.MediaRef;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.ServerEvent;
import com.rebenew.watchParty.syncserver.model.SyncPayloads;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Transiciones de cola y reproducción reservadas al host. Cada una muta la sala y difunde el
 * resultado a todos los miembros, host incluido, con el lock de la sala tomado.
 */
@Service
public class PlaybackService {
    private static final Logger logger = LoggerFactory.getLogger(PlaybackService.class);

    private final RoomSessionManager roomSessionManager;

    public PlaybackService(RoomSessionManager roomSessionManager) {
        this.roomSessionManager = roomSessionManager;
    }

    public void loadMedia(String roomCode, String userId, MediaRef media, boolean addToQueue) {
        roomSessionManager.withHost(roomCode, userId, room -> {
            room.loadMedia(media, addToQueue);
            roomSessionManager.publish(room, ServerEvent.MEDIA_UPDATED, room.mediaUpdate());
            logger.info("🎞️ {} {}:{} in room {} (queue size {})",
                    addToQueue ? "Queued" : "Loaded", media.type(), media.id(), roomCode, room.getQueueSize());
        });
    }

    public void play(String roomCode, String userId, double currentTime) {
        roomSessionManager.withHost(roomCode, userId, room -> {
            room.play(currentTime);
            long timestamp = roomSessionManager.currentTimestamp();
            roomSessionManager.publish(room, ServerEvent.SYNC_PLAY, new SyncPayloads.SyncPlay(currentTime, timestamp));
            logger.info("▶️ Playback started in room {} at {}s", roomCode, currentTime);
        });
    }

    public void pause(String roomCode, String userId) {
        roomSessionManager.withHost(roomCode, userId, room -> {
            room.pause();
            long timestamp = roomSessionManager.currentTimestamp();
            roomSessionManager.publish(room, ServerEvent.SYNC_PAUSE, new SyncPayloads.SyncPause(timestamp));
            logger.info("⏸️ Playback paused in room {}", roomCode);
        });
    }

    public void seek(String roomCode, String userId, double newTime) {
        roomSessionManager.withHost(roomCode, userId, room -> {
            room.seek(newTime);
            long timestamp = roomSessionManager.currentTimestamp();
            roomSessionManager.publish(room, ServerEvent.SYNC_SEEK, new SyncPayloads.SyncSeek(newTime, timestamp));
            logger.info("🔍 Seek in room {} to {}s", roomCode, newTime);
        });
    }

    public void nextVideo(String roomCode, String userId) {
        navigate(roomCode, userId, 1);
    }

    public void previousVideo(String roomCode, String userId) {
        navigate(roomCode, userId, -1);
    }

    private void navigate(String roomCode, String userId, int delta) {
        roomSessionManager.withHost(roomCode, userId, room -> {
            if (room.getQueueSize() == 0) {
                logger.warn("Navigation on empty queue in room {}", roomCode);
                throw new RoomOperationException(RoomError.EMPTY_QUEUE, "La cola está vacía");
            }
            room.step(delta);
            announceItemChange(room);
            logger.info("{} Room {} now at index {} of {}", delta > 0 ? "⏭️" : "⏮️",
                    roomCode, room.getCurrentIndex(), room.getQueueSize());
        });
    }

    // Los clientes reinician su reproductor al inicio del nuevo elemento con el mismo timestamp.
    private void announceItemChange(Room room) {
        roomSessionManager.publish(room, ServerEvent.MEDIA_UPDATED, room.mediaUpdate());
        long timestamp = roomSessionManager.currentTimestamp();
        roomSessionManager.publish(room, ServerEvent.SYNC_SEEK, new SyncPayloads.SyncSeek(0.0, timestamp));
    }
}
