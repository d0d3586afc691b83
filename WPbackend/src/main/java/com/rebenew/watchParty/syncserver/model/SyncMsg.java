package com.rebenew.watchParty.syncserver.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.rebenew.watchParty.syncserver.error.RoomError;
import lombok.Getter;
import lombok.Setter;

import java.util.Map;

/**
 * Sobre WebSocket usado en ambos sentidos.
 *
 * Entrante: {"event": "play", "roomCode": "K3X9QZ", "correlationId": "42", "data": {"currentTime": 5.0}}
 * Saliente: {"event": "sync-play", "roomCode": "K3X9QZ", "data": {"currentTime": 5.0, "timestamp": 1700000000000}}
 */
@Getter
@Setter
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncMsg {
    private String event;
    private String roomCode;
    private String correlationId;
    private Object data;

    // ==================== FACTORÍAS ====================

    public static SyncMsg of(ServerEvent event, String roomCode, Object data) {
        return new SyncMsg(event.wireName(), roomCode, data);
    }

    public static SyncMsg error(RoomError error, String message, String roomCode, String correlationId) {
        SyncMsg msg = new SyncMsg(ServerEvent.ERROR.wireName(), roomCode,
                new SyncPayloads.ErrorNotice(error.code(), message));
        msg.setCorrelationId(correlationId);
        return msg;
    }

    private SyncMsg(String event, String roomCode, Object data) {
        this.event = event;
        this.roomCode = roomCode;
        this.data = data;
    }

    // Jackson
    public SyncMsg() {
    }

    // ==================== ACCESO A DATA ====================

    @JsonIgnore
    @SuppressWarnings("unchecked")
    public Map<String, Object> getDataAsMap() {
        return data instanceof Map ? (Map<String, Object>) data : null;
    }

    public boolean hasData(String key) {
        return getRawData(key) != null;
    }

    public Object getRawData(String key) {
        Map<String, Object> dataMap = getDataAsMap();
        return dataMap != null ? dataMap.get(key) : null;
    }

    public String getStringData(String key) {
        Object value = getRawData(key);
        return value instanceof String ? (String) value : null;
    }

    public Double getDoubleData(String key) {
        Object value = getRawData(key);
        if (value instanceof Number)
            return ((Number) value).doubleValue();
        if (value instanceof String) {
            try {
                return Double.parseDouble((String) value);
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public Boolean getBoolData(String key) {
        Object value = getRawData(key);
        if (value instanceof Boolean)
            return (Boolean) value;
        if (value instanceof String)
            return Boolean.parseBoolean((String) value);
        return null;
    }

    public boolean getBoolData(String key, boolean defaultValue) {
        Boolean value = getBoolData(key);
        return value != null ? value : defaultValue;
    }

    @Override
    public String toString() {
        return String.format("SyncMsg{event='%s', roomCode='%s', correlationId='%s'}",
                event, roomCode, correlationId);
    }
}
