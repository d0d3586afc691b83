package com.rebenew.watchParty.syncserver.controller;

import com.rebenew.watchParty.syncserver.core.InMemoryRoomStore;
import com.rebenew.watchParty.syncserver.core.RecordingBroadcaster;
import com.rebenew.watchParty.syncserver.core.RoomSessionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class RoomControllerTest {

    private RoomSessionManager manager;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-01-01T10:00:00Z"), ZoneId.of("UTC"));
        Iterator<String> codes = List.of("ZZZZZZ", "AAAAAA").iterator();
        manager = new RoomSessionManager(new InMemoryRoomStore(codes::next, 1, clock), new RecordingBroadcaster(), clock);
        mockMvc = MockMvcBuilders.standaloneSetup(new RoomController(manager)).build();
    }

    @Test
    void listsActiveRoomsSorted() throws Exception {
        manager.createRoom("c1", "One");
        manager.createRoom("c2", "Two");

        mockMvc.perform(get("/rooms"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("AAAAAA"))
                .andExpect(jsonPath("$[1]").value("ZZZZZZ"));
    }

    @Test
    void describesExistingRoom() throws Exception {
        manager.createRoom("c1", "One");
        manager.joinRoom("ZZZZZZ", "c2", "Two");

        mockMvc.perform(get("/rooms/zzzzzz"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roomCode").value("ZZZZZZ"))
                .andExpect(jsonPath("$.exists").value(true))
                .andExpect(jsonPath("$.memberCount").value(2))
                .andExpect(jsonPath("$.queueSize").value(0))
                .andExpect(jsonPath("$.createdAt").value("2025-01-01T10:00:00Z"));
    }

    @Test
    void unknownRoomIsNotFound() throws Exception {
        mockMvc.perform(get("/rooms/NOPE42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("room_not_found"));
    }

    @Test
    void deletedRoomDisappears() throws Exception {
        manager.createRoom("c1", "One");
        manager.leaveRoom("ZZZZZZ", "c1");

        mockMvc.perform(get("/rooms/ZZZZZZ")).andExpect(status().isNotFound());
        mockMvc.perform(get("/rooms")).andExpect(jsonPath("$").isEmpty());
    }
}
