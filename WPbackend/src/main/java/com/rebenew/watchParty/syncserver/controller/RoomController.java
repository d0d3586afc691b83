package com.rebenew.watchParty.syncserver.controller;

import com.rebenew.watchParty.syncserver.core.RoomSessionManager;
import com.rebenew.watchParty.syncserver.error.RoomError;
import com.rebenew.watchParty.syncserver.model.Room;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Vista HTTP de solo lectura de las salas activas. Crear y unirse solo se hace por WebSocket.
 */
@RestController
@RequestMapping("/rooms")
public class RoomController {
    private static final Logger logger = LoggerFactory.getLogger(RoomController.class);

    private final RoomSessionManager sessionManager;

    public RoomController(RoomSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    /**
     * Lista ordenada de los códigos de las salas activas.
     */
    @GetMapping
    public ResponseEntity<List<String>> listRooms() {
        List<String> codes = sessionManager.activeRoomCodes();
        logger.debug("📋 Listando {} salas activas", codes.size());
        return ResponseEntity.ok(codes);
    }

    /**
     * Resumen de una sala: si existe, miembros, tamaño de cola y fecha de creación.
     *
     * @param roomCode código de sala, sin distinguir mayúsculas
     * @return 200 con el resumen, o 404 {"error": "room_not_found"}
     */
    @GetMapping("/{roomCode}")
    public ResponseEntity<?> getRoom(@PathVariable String roomCode) {
        String code = roomCode.trim().toUpperCase(Locale.ROOT);
        logger.debug("🔍 Buscando sala: {}", code);

        Optional<Room> room = sessionManager.findRoom(code);
        if (room.isEmpty()) {
            logger.debug("Sala {} no encontrada", code);
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(Map.of("error", RoomError.ROOM_NOT_FOUND.code()));
        }
        return ResponseEntity.ok(room.get().toRoomResponse());
    }
}
