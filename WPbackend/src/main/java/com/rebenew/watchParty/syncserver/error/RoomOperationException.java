package com.rebenew.watchParty.syncserver.error;

/**
 * Lanzada por la máquina de estados de la sala cuando falla una precondición, antes de mutar nada.
 */
public class RoomOperationException extends RuntimeException {

    private final RoomError error;

    public RoomOperationException(RoomError error, String message) {
        super(message);
        this.error = error;
    }

    public RoomError getError() {
        return error;
    }
}
