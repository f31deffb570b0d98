package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.protocol.ChannelCommand;
import com.chirm.chatapp.websocket.protocol.SubscribeCommand;
import com.chirm.chatapp.websocket.protocol.VoiceEvents;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 텍스트 채널 구독과 타이핑 알림.
 * 연결당 보고 있는 채널은 하나이며 마지막 subscribe 가 이긴다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChannelViewHandler {

    private final Hub hub;

    public void handleSubscribe(Connection connection, SubscribeCommand command) {
        String channelId = command.channelId();
        connection.setViewedChannelId(channelId == null || channelId.isBlank() ? null : channelId);
        log.debug("[SUBSCRIBE] connectionId={} channelId={}", connection.getId(), channelId);
    }

    public void handleTyping(Connection connection, ChannelCommand command) {
        hub.broadcastToChannel(command.channelId(), VoiceEvents.typing(command.channelId(), connection.getUserId()));
    }
}
