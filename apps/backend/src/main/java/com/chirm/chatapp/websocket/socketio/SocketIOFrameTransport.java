package com.chirm.chatapp.websocket.socketio;

import com.chirm.chatapp.websocket.hub.EncodedFrame;
import com.chirm.chatapp.websocket.hub.FrameTransport;
import com.corundumstudio.socketio.SocketIOClient;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Socket.IO 클라이언트 위에서 동작하는 프레임 전송 계층.
 * 프레임 텍스트를 FRAME 이벤트의 인자로 그대로 보낸다.
 */
@Slf4j
@RequiredArgsConstructor
public class SocketIOFrameTransport implements FrameTransport {

    private final SocketIOClient client;

    @Override
    public void write(EncodedFrame frame) throws IOException {
        if (!client.isChannelOpen()) {
            throw new IOException("Socket.IO channel closed - sessionId: " + client.getSessionId());
        }
        client.sendEvent(SocketIOEvents.FRAME, frame.text());
    }

    @Override
    public void close() {
        if (!client.isChannelOpen()) {
            return;
        }
        try {
            client.disconnect();
        } catch (RuntimeException e) {
            log.debug("Socket.IO disconnect failed - sessionId: {}, cause: {}", client.getSessionId(), e.getMessage());
        }
    }
}
