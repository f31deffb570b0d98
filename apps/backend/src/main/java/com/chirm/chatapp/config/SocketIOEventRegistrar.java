package com.chirm.chatapp.config;

import com.chirm.chatapp.websocket.socketio.SocketIOEvents;
import com.chirm.chatapp.websocket.socketio.handler.ConnectionLoginHandler;
import com.chirm.chatapp.websocket.socketio.handler.InboundFrameHandler;
import com.corundumstudio.socketio.SocketIOServer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Socket.IO 이벤트 핸들러 등록자.
 *
 * 모든 Bean 생성이 끝난 ApplicationReadyEvent 시점에 핸들러를 등록하고 서버를 시작한다.
 * 핸들러 등록 전에 서버가 먼저 열려 연결 이벤트를 놓치는 일을 막는다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
public class SocketIOEventRegistrar {

    private final SocketIOServer socketIOServer;
    private final ConnectionLoginHandler connectionLoginHandler;
    private final InboundFrameHandler inboundFrameHandler;

    @EventListener(ApplicationReadyEvent.class)
    public void registerEventHandlers() {
        // @OnConnect / @OnDisconnect
        socketIOServer.addListeners(connectionLoginHandler);
        socketIOServer.addEventListener(SocketIOEvents.FRAME, String.class, inboundFrameHandler);

        socketIOServer.start();
        log.info("Socket.IO server started - port: {}", socketIOServer.getConfiguration().getPort());
    }
}
