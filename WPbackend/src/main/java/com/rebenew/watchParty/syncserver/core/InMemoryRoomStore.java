package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.error.RoomCodeExhaustedException;
import com.rebenew.watchParty.syncserver.model.Room;
import com.rebenew.watchParty.syncserver.model.RoomMember;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link RoomStore} en memoria del proceso. Las salas se pierden al reiniciar.
 */
public class InMemoryRoomStore implements RoomStore {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryRoomStore.class);

    private final ConcurrentHashMap<String, Room> rooms = new ConcurrentHashMap<>();
    private final RoomCodeGenerator codeGenerator;
    private final int maxCodeAttempts;
    private final Clock clock;

    public InMemoryRoomStore(RoomCodeGenerator codeGenerator, int maxCodeAttempts, Clock clock) {
        if (maxCodeAttempts < 1) {
            throw new IllegalArgumentException("maxCodeAttempts debe ser positivo, recibido " + maxCodeAttempts);
        }
        this.codeGenerator = codeGenerator;
        this.maxCodeAttempts = maxCodeAttempts;
        this.clock = clock;
    }

    @Override
    public Room create(String creatorId, String displayName) {
        RoomMember creator = new RoomMember(creatorId, displayName);
        for (int attempt = 1; attempt <= maxCodeAttempts; attempt++) {
            String code = codeGenerator.nextCode();
            Room candidate = new Room(code, creator, clock.instant());
            // putIfAbsent es el punto de confirmación: dos creadores nunca obtienen el mismo código
            if (rooms.putIfAbsent(code, candidate) == null) {
                if (attempt > 1)
                    logger.debug("Código {} asignado tras {} intentos", code, attempt);
                return candidate;
            }
            logger.debug("Colisión de código {} (intento {})", code, attempt);
        }
        logger.error("🚨 Sin códigos de sala libres tras {} intentos ({} salas activas)", maxCodeAttempts, rooms.size());
        throw new RoomCodeExhaustedException(maxCodeAttempts);
    }

    @Override
    public Optional<Room> find(String roomCode) {
        if (roomCode == null)
            return Optional.empty();
        return Optional.ofNullable(rooms.get(roomCode));
    }

    @Override
    public boolean exists(String roomCode) {
        return roomCode != null && rooms.containsKey(roomCode);
    }

    @Override
    public boolean delete(String roomCode) {
        return roomCode != null && rooms.remove(roomCode) != null;
    }

    @Override
    public List<String> roomCodes() {
        return rooms.keySet().stream().sorted().toList();
    }

    @Override
    public int size() {
        return rooms.size();
    }
}
