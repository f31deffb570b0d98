package com.chirm.chatapp.websocket.socketio.handler;

import com.chirm.chatapp.websocket.hub.Connection;
import com.chirm.chatapp.websocket.hub.Hub;
import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry;
import com.chirm.chatapp.websocket.socketio.AuthTokenListenerImpl;
import com.chirm.chatapp.websocket.socketio.SocketIOFrameTransport;
import com.chirm.chatapp.websocket.socketio.SocketUser;
import com.corundumstudio.socketio.SocketIOClient;
import com.corundumstudio.socketio.annotation.OnConnect;
import com.corundumstudio.socketio.annotation.OnDisconnect;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Component;

/**
 * Socket.IO 연결/해제 처리.
 *
 * - 연결: 인증된 사용자로 Connection 을 만들고 Hub 에 등록한 뒤 writer 를 시작한다.
 * - 해제: Hub.unregister 로 전역 집합과 음성 방에서 정리한다.
 *
 * writer 종료와 disconnect 이벤트가 모두 unregister 를 호출할 수 있으며,
 * unregister 는 idempotent 하므로 정리는 정확히 한 번만 일어난다.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
public class ConnectionLoginHandler {

    public static final String CONNECTION_KEY = "connection";

    private final Hub hub;
    private final Executor connectionWriterExecutor;
    private final int queueCapacity;

    public ConnectionLoginHandler(
            Hub hub,
            VoiceRoomRegistry voiceRooms,
            MeterRegistry meterRegistry,
            @Qualifier("connectionWriterExecutor") Executor connectionWriterExecutor,
            @Value("${hub.connection.queue-capacity:256}") int queueCapacity
    ) {
        this.hub = hub;
        this.connectionWriterExecutor = connectionWriterExecutor;
        this.queueCapacity = queueCapacity;

        Gauge.builder("socketio.concurrent.connections", hub::connectionCount)
                .description("Current number of registered hub connections")
                .register(meterRegistry);
        Gauge.builder("socketio.voice.rooms", voiceRooms::roomCount)
                .description("Current number of active voice rooms")
                .register(meterRegistry);
    }

    @OnConnect
    public void onConnect(SocketIOClient client) {
        SocketUser socketUser = client.get(AuthTokenListenerImpl.USER_KEY);
        if (socketUser == null) {
            log.warn("Connect without auth, disconnect");
            client.disconnect();
            return;
        }

        Connection connection = new Connection(
                client.getSessionId().toString(),
                socketUser.id(),
                new SocketIOFrameTransport(client),
                queueCapacity
        );
        client.set(CONNECTION_KEY, connection);
        hub.register(connection);

        try {
            connection.startWriter(connectionWriterExecutor, hub::unregister);
        } catch (TaskRejectedException e) {
            log.error("[CONNECT] writer rejected, dropping connection - userId={} socketId={}",
                    socketUser.id(), connection.getId(), e);
            hub.unregister(connection);
            return;
        }

        log.info("[CONNECT] userId={} socketId={}", socketUser.id(), connection.getId());
    }

    @OnDisconnect
    public void onDisconnect(SocketIOClient client) {
        Connection connection = client.get(CONNECTION_KEY);
        if (connection == null) {
            return;
        }
        try {
            if (hub.unregister(connection)) {
                log.info("[DISCONNECT] userId={} socketId={}", connection.getUserId(), connection.getId());
            }
        } catch (Exception e) {
            log.error("Error handling Socket.IO disconnection - socketId={}", connection.getId(), e);
        } finally {
            client.del(CONNECTION_KEY);
            client.del(AuthTokenListenerImpl.USER_KEY);
        }
    }
}
