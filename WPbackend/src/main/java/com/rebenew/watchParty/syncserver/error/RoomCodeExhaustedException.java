package com.rebenew.watchParty.syncserver.error;

/**
 * No se encontró un código de sala libre en el número de intentos configurado.
 * Se trata como error de configuración: el espacio de códigos es pequeño para las salas vivas.
 */
public class RoomCodeExhaustedException extends IllegalStateException {

    public RoomCodeExhaustedException(int attempts) {
        super("Sin código de sala libre tras " + attempts + " intentos; aumenta watchparty.rooms.code-length");
    }
}
