package com.chirm.chatapp.dto;

public record HealthResponse(String status, int connections, int voiceRooms) {

    public static HealthResponse ok(int connections, int voiceRooms) {
        return new HealthResponse("ok", connections, voiceRooms);
    }
}
