package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry.JoinResult;
import com.chirm.chatapp.websocket.hub.WsEvent;
import com.chirm.chatapp.websocket.protocol.ChannelCommand;
import com.chirm.chatapp.websocket.protocol.VoiceEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 음성 방 입장 처리 핸들러
 *
 * 1. 방 레지스트리에 추가
 * 2. 본인에게 기존 참가자 목록 (voice.room_state)
 * 3. 신규 입장이면 방 참가자(본인 제외)와 서버 전체에 voice.joined
 *
 * 전체 브로드캐스트는 사이드바 참가자 수 표시용이다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class VoiceJoinHandler {

    private final Hub hub;
    private final VoiceRoomRegistry voiceRooms;

    public void handleJoin(Connection connection, ChannelCommand command) {
        String channelId = command.channelId();
        JoinResult result = voiceRooms.join(channelId, connection);

        hub.sendTo(connection, VoiceEvents.roomState(channelId, result.existingUserIds()));

        if (!result.newlyJoined()) {
            log.debug("[JOIN] already in room - userId={} channelId={}", connection.getUserId(), channelId);
            return;
        }
        // room_state 전송 중 큐가 가득 차 퇴출되었으면 이미 voice.left 가 나갔으므로 입장을 알리지 않는다
        if (!voiceRooms.contains(channelId, connection)) {
            log.debug("[JOIN] evicted before announce - userId={} channelId={}", connection.getUserId(), channelId);
            return;
        }

        log.info("[JOIN] userId={} channelId={} existing={}", connection.getUserId(), channelId, result.existingUserIds());

        WsEvent joined = VoiceEvents.joined(channelId, connection.getUserId());
        hub.broadcastToRoom(channelId, joined, connection);
        hub.broadcast(joined);
    }
}
