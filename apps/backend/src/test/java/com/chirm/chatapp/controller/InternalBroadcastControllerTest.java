package com.chirm.chatapp.controller;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.chirm.chatapp.websocket.socketio.broadcast.BroadcastService;
import com.fasterxml.jackson.databind.JsonNode;
import jakarta.validation.Validation;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class InternalBroadcastControllerTest {

    private static final String TOKEN = "test-internal-token";

    private final ValidatorFactory validatorFactory = Validation.buildDefaultValidatorFactory();
    private BroadcastService broadcastService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        broadcastService = mock(BroadcastService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(
                new InternalBroadcastController(broadcastService, validatorFactory.getValidator(), TOKEN)
        ).build();
    }

    @AfterEach
    void tearDown() {
        validatorFactory.close();
    }

    @Test
    void channelScopeIsForwarded() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"CHANNEL\",\"target\":\"general\",\"type\":\"message.new\","
                                + "\"data\":{\"id\":\"m1\"}}"))
                .andExpect(status().isNoContent());

        verify(broadcastService).broadcastToChannel(eq("general"), eq("message.new"),
                argThat(data -> ((JsonNode) data).path("id").asText().equals("m1")));
    }

    @Test
    void globalScopeNeedsNoTarget() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GLOBAL\",\"type\":\"channel.new\",\"data\":{\"id\":\"ch1\"}}"))
                .andExpect(status().isNoContent());

        verify(broadcastService).broadcast(eq("channel.new"), any());
    }

    @Test
    void userAndRoomScopesAreForwarded() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"USER\",\"target\":\"u1\",\"type\":\"notice\",\"data\":{}}"))
                .andExpect(status().isNoContent());
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"ROOM\",\"target\":\"general-voice\",\"type\":\"notice\",\"data\":{}}"))
                .andExpect(status().isNoContent());

        verify(broadcastService).sendToUser(eq("u1"), eq("notice"), any());
        verify(broadcastService).broadcastToRoom(eq("general-voice"), eq("notice"), any());
    }

    @Test
    void wrongTokenIsRejected() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer nope")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GLOBAL\",\"type\":\"channel.new\",\"data\":{}}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(broadcastService);
    }

    @Test
    void missingTokenIsRejectedEvenWithInvalidBody() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"CHANNEL\"}"))
                .andExpect(status().isUnauthorized());

        verifyNoInteractions(broadcastService);
    }

    @Test
    void scopedRequestWithoutTargetIsBadRequest() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"CHANNEL\",\"type\":\"message.new\",\"data\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(broadcastService);
    }

    @Test
    void missingTypeIsBadRequest() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GLOBAL\",\"data\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(broadcastService);
    }

    @Test
    void unknownScopeIsBadRequest() throws Exception {
        mockMvc.perform(post("/internal/broadcast")
                        .header(HttpHeaders.AUTHORIZATION, "Bearer " + TOKEN)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scope\":\"GALAXY\",\"type\":\"x\",\"data\":{}}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(broadcastService);
    }
}
