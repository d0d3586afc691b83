package com.rebenew.watchParty.syncserver.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rebenew.watchParty.syncserver.core.InMemoryRoomStore;
import com.rebenew.watchParty.syncserver.core.RandomRoomCodeGenerator;
import com.rebenew.watchParty.syncserver.core.RoomCodeGenerator;
import com.rebenew.watchParty.syncserver.core.RoomStore;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.server.standard.ServletServerContainerFactoryBean;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(WatchPartyProperties.class)
public class AppConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        return mapper;
    }

    // Origen de los timestamps de los eventos de sync
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RoomCodeGenerator roomCodeGenerator(WatchPartyProperties properties) {
        return new RandomRoomCodeGenerator(properties.getRooms().getCodeLength());
    }

    @Bean
    public RoomStore roomStore(RoomCodeGenerator roomCodeGenerator, WatchPartyProperties properties, Clock clock) {
        return new InMemoryRoomStore(roomCodeGenerator, properties.getRooms().getMaxCodeAttempts(), clock);
    }

    @Bean
    public ServletServerContainerFactoryBean createWebSocketContainer(WatchPartyProperties properties) {
        ServletServerContainerFactoryBean container = new ServletServerContainerFactoryBean();
        container.setMaxTextMessageBufferSize(properties.getWebsocket().getMaxTextMessageSize());
        container.setMaxBinaryMessageBufferSize(properties.getWebsocket().getMaxTextMessageSize());
        container.setMaxSessionIdleTimeout(properties.getWebsocket().getMaxSessionIdleTimeoutMs());
        return container;
    }
}
