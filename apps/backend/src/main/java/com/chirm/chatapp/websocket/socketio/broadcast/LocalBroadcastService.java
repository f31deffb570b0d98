package com.chirm.chatapp.websocket.socketio.broadcast;

import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.WsEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 로컬 브로드캐스트 서비스 (단일 서버용).
 *
 * 프로세스 내 Hub 로 직접 전달한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LocalBroadcastService implements BroadcastService {

    private final Hub hub;

    @Override
    public void broadcast(String type, Object data) {
        hub.broadcast(WsEvent.of(type, data));
        log.debug("Broadcast (local) - type: {}", type);
    }

    @Override
    public void broadcastToChannel(String channelId, String type, Object data) {
        hub.broadcastToChannel(channelId, WsEvent.of(type, data));
        log.debug("Broadcast to channel (local) - channel: {}, type: {}", channelId, type);
    }

    @Override
    public void sendToUser(String userId, String type, Object data) {
        hub.sendToUser(userId, WsEvent.of(type, data));
        log.debug("Send to user (local) - user: {}, type: {}", userId, type);
    }

    @Override
    public void broadcastToRoom(String channelId, String type, Object data) {
        hub.broadcastToRoom(channelId, WsEvent.of(type, data), null);
        log.debug("Broadcast to voice room (local) - channel: {}, type: {}", channelId, type);
    }
}
