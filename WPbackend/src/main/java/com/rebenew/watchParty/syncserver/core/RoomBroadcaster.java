package com.rebenew.watchParty.syncserver.core;

import com.rebenew.watchParty.syncserver.model.SyncMsg;

import java.util.Set;

/**
 * Pertenencia a grupos del transporte más entrega "fire-and-forget".
 *
 * La entrega es como mucho una vez y sin garantías: un envío fallido a una conexión lo registra
 * la implementación y nunca se reporta hacia arriba, así que una mutación ya confirmada no se deshace.
 */
public interface RoomBroadcaster {

    /**
     * Suscribe la conexión al grupo de la sala.
     *
     * @return false si la conexión ya está cerrada; en ese caso no se suscribe a nada
     */
    boolean subscribe(String roomCode, String connectionId);

    void unsubscribe(String roomCode, String connectionId);

    /**
     * Códigos de sala a los que la conexión está suscrita, como copia.
     */
    Set<String> roomsOf(String connectionId);

    void publish(String roomCode, SyncMsg message, String excludeConnectionId);

    default void publish(String roomCode, SyncMsg message) {
        publish(roomCode, message, null);
    }

    void sendTo(String connectionId, SyncMsg message);
}
