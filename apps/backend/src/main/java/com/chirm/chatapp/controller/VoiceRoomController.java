package com.chirm.chatapp.controller;

import com.chirm.chatapp.dto.VoiceRoomsResponse;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@Tag(name = "음성 (Voice)", description = "음성 방 현황 API")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/voice")
public class VoiceRoomController {

    private final VoiceRoomRegistry voiceRooms;

    /**
     * 현재 음성 방 참가자 스냅샷. 방이 없으면 빈 객체를 돌려준다.
     */
    @Operation(summary = "음성 방 목록", description = "채널별 음성 방 참가자 ID 목록을 조회합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "200", description = "조회 성공",
            content = @Content(schema = @Schema(implementation = VoiceRoomsResponse.class))),
        @ApiResponse(responseCode = "401", description = "인증 실패", content = @Content)
    })
    @GetMapping("/rooms")
    public ResponseEntity<VoiceRoomsResponse> getRooms() {
        return ResponseEntity.ok(new VoiceRoomsResponse(voiceRooms.snapshot()));
    }
}
