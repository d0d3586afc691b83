package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.Room;

import java.util.List;
import java.util.Optional;

/**
 * Registro de salas activas por código.
 */
public interface RoomStore {

    /**
     * Crea una sala con el llamante como único miembro y host, bajo un código que ninguna sala activa usa.
     * Generar el código e insertar la sala es atómico frente a llamadas concurrentes.
     *
     * @throws com.rebenew.watchParty.syncserver.error.RoomCodeExhaustedException si no hay código libre
     */
    Room create(String creatorId, String displayName);

    Optional<Room> find(String roomCode);

    boolean exists(String roomCode);

    /**
     * Elimina la sala. Solo se llama cuando ya no le quedan miembros.
     */
    boolean delete(String roomCode);

    List<String> roomCodes();

    int size();
}
