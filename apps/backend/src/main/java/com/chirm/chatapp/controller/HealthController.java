package com.chirm.chatapp.controller;

import com.chirm.chatapp.dto.HealthResponse;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "상태 (Health)", description = "서버 상태 확인 API")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api")
public class HealthController {

    private final Hub hub;
    private final VoiceRoomRegistry voiceRooms;

    @Operation(summary = "서버 상태", description = "현재 연결 수와 음성 방 수를 반환합니다.")
    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(HealthResponse.ok(hub.connectionCount(), voiceRooms.roomCount()));
    }
}
