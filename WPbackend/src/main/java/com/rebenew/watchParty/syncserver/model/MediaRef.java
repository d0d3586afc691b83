package com.rebenew.watchParty.syncserver.model;

/**
 * Referencia a un elemento reproducible de la cola, p. ej. {"type": "youtube", "id": "dQw4w9WgXcQ"}.
 */
public record MediaRef(String type, String id) {
    public MediaRef {
        if (type == null || type.trim().isEmpty()) {
            throw new IllegalArgumentException("type de media no puede estar vacío");
        }
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id de media no puede estar vacío");
        }
    }
}
