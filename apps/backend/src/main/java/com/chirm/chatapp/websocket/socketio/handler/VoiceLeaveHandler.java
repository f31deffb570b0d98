package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import com.chirm.chatapp.websocket.protocol.ChannelCommand;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 음성 방 퇴장 처리 핸들러
 * 실제로 방에 있었던 경우에만 voice.left 를 보낸다 (중복 알림 방지).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoiceLeaveHandler {

    private final Hub hub;
    private final VoiceRoomRegistry voiceRooms;

    public void handleLeave(Connection connection, ChannelCommand command) {
        String channelId = command.channelId();
        if (!voiceRooms.leave(channelId, connection)) {
            return;
        }

        log.info("[LEAVE] userId={} channelId={}", connection.getUserId(), channelId);
        hub.announceVoiceLeft(channelId, connection.getUserId());
    }
}
