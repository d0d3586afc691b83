package com.rebenew.watchParty.syncserver.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Enlaza las claves {@code watchparty.*} de application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "watchparty")
public class WatchPartyProperties {

    private Rooms rooms = new Rooms();
    private Websocket websocket = new Websocket();
    private Cors cors = new Cors();

    @Getter
    @Setter
    public static class Rooms {
        private int codeLength = 6;
        // límite de regeneraciones de código; alcanzarlo indica un espacio de códigos demasiado pequeño
        private int maxCodeAttempts = 1000;
        private int maxDisplayNameLength = 50;
        private int maxChatLength = 1000;
    }

    @Getter
    @Setter
    public static class Websocket {
        private String path = "/ws/sync";
        private String[] allowedOriginPatterns = {"*"};
        private int maxTextMessageSize = 8192;
        private long maxSessionIdleTimeoutMs = 300_000L;
    }

    @Getter
    @Setter
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>(List.of("http://localhost:3000", "http://localhost:8080"));
    }
}
