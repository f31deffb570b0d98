package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.protocol.ChannelCommand;
import com.chirm.chatapp.websocket.protocol.DecodedCommand;
import com.chirm.chatapp.websocket.protocol.InboundFrameDecoder;
import com.chirm.chatapp.websocket.protocol.MediaStateCommand;
import com.chirm.chatapp.websocket.protocol.SignalCommand;
import com.chirm.chatapp.websocket.protocol.SubscribeCommand;
import com.corundumstudio.socketio.AckRequest;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.listener.DataListener;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * FRAME 이벤트 수신 후 type 별 핸들러로 분기한다.
 *
 * 어떤 경우에도 예외를 밖으로 던지지 않는다. 잘못된 프레임은 버리고 연결은 유지한다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class InboundFrameHandler implements DataListener<String> {

    private final InboundFrameDecoder decoder;
    private final ChannelViewHandler channelViewHandler;
    private final VoiceJoinHandler voiceJoinHandler;
    private final VoiceLeaveHandler voiceLeaveHandler;
    private final VoiceSignalHandler voiceSignalHandler;

    @Override
    public void onData(SocketIOClient client, String frame, AckRequest ackRequest) {
        Connection connection = client.get(ConnectionLoginHandler.CONNECTION_KEY);
        if (connection == null) {
            log.debug("Frame from unregistered socket ignored - sessionId={}", client.getSessionId());
            return;
        }
        handleFrame(connection, frame);
    }

    public void handleFrame(Connection connection, String frame) {
        Optional<DecodedCommand> decoded = decoder.decode(frame);
        if (decoded.isEmpty()) {
            return;
        }

        DecodedCommand command = decoded.get();
        try {
            switch (command.type()) {
                case SUBSCRIBE -> channelViewHandler.handleSubscribe(connection, command.commandAs(SubscribeCommand.class));
                case TYPING -> channelViewHandler.handleTyping(connection, command.commandAs(ChannelCommand.class));
                case VOICE_JOIN -> voiceJoinHandler.handleJoin(connection, command.commandAs(ChannelCommand.class));
                case VOICE_LEAVE -> voiceLeaveHandler.handleLeave(connection, command.commandAs(ChannelCommand.class));
                case VOICE_OFFER, VOICE_ANSWER, VOICE_ICE -> voiceSignalHandler.handleSignal(
                        connection, command.type().getTag(), command.commandAs(SignalCommand.class));
                case VOICE_MEDIA_STATE -> voiceSignalHandler.handleMediaState(
                        connection, command.commandAs(MediaStateCommand.class));
            }
        } catch (Exception e) {
            log.error("Error handling frame - type={} connectionId={}", command.type().getTag(), connection.getId(), e);
        }
    }
}
