package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.SignalingRelay;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import com.chirm.chatapp.websocket.protocol.MediaStateCommand;
import com.chirm.chatapp.websocket.protocol.SignalCommand;
import com.chirm.chatapp.websocket.protocol.VoiceEvents;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * WebRTC 시그널링과 카메라/화면공유 상태 전파.
 */
@Component
@RequiredArgsConstructor
public class VoiceSignalHandler {

    private final Hub hub;
    private final SignalingRelay signalingRelay;
    private final VoiceRoomRegistry voiceRooms;

    public void handleSignal(Connection connection, String signalType, SignalCommand command) {
        signalingRelay.relay(connection, command.channelId(), command.targetUserId(), signalType, command.payload());
    }

    // 트랙 감지에 의존하지 않고 비디오 타일/아바타 전환을 할 수 있도록 방 전체에 알린다.
    // 방에 없는 연결이 보낸 상태는 버린다.
    public void handleMediaState(Connection connection, MediaStateCommand command) {
        if (!voiceRooms.contains(command.channelId(), connection)) {
            return;
        }
        hub.broadcastToRoom(command.channelId(), VoiceEvents.mediaState(
                command.channelId(),
                connection.getUserId(),
                command.camEnabled(),
                command.screenSharing()
        ), connection);
    }
}
