package com.rebenew.watchParty.syncserver.error;

/**
 * Tipos de error que se devuelven a la conexión que hizo la petición. Ninguno cierra la
 * conexión ni cambia el estado de la sala.
 */
public enum RoomError {
    ROOM_NOT_FOUND("room_not_found"),
    NOT_A_MEMBER("not_a_member"),
    NOT_HOST("not_host"),
    EMPTY_QUEUE("empty_queue"),
    INVALID_REQUEST("invalid_request"),
    // la conexión se cerró mientras su mensaje seguía en curso; no llega a nadie
    CONNECTION_CLOSED("connection_closed"),
    INTERNAL_ERROR("internal_error");

    private final String code;

    RoomError(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
