package com.rebenew.watchParty.syncserver.model;

/**
 * Mensajes de señalización de llamada P2P, reenviados tal cual a un único destinatario.
 * {@code payloadField} es la clave de data que lleva el payload opaco en ambos sentidos.
 */
public enum SignalKind {
    VOICE_OFFER(ServerEvent.VOICE_OFFER, "offer"),
    VOICE_ANSWER(ServerEvent.VOICE_ANSWER, "answer"),
    ICE_CANDIDATE(ServerEvent.ICE_CANDIDATE, "candidate");

    private final ServerEvent event;
    private final String payloadField;

    SignalKind(ServerEvent event, String payloadField) {
        this.event = event;
        this.payloadField = payloadField;
    }

    public ServerEvent event() {
        return event;
    }

    public String payloadField() {
        return payloadField;
    }
}
