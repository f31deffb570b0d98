package com.chirm.chatapp.config;

import com.corundumstudio.socketio.AuthTokenListener;
import com.corundumstudio.socketio.SocketConfig;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.corundumstudio.socketio.namespace.Namespace;
import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.corundumstudio.socketio.store.MemoryStoreFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Socket.IO 서버 설정.
 *
 * Hub 상태가 프로세스 메모리에만 있으므로 세션 스토어도 MemoryStoreFactory 를 사용한다.
 */
@Slf4j
@Configuration
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
public class SocketIOConfig {

    @Value("${socketio.server.host:localhost}")
    private String host;

    @Value("${socketio.server.port:5002}")
    private Integer port;

    @Value("${socketio.ping-interval:25000}")
    private int pingInterval;

    @Value("${socketio.ping-timeout:60000}")
    private int pingTimeout;

    // 메시지당 최대 64KB
    @Value("${socketio.max-frame-payload:65536}")
    private int maxFramePayload;

    @Value("${socketio.origin:}")
    private String origin;

    @Bean(destroyMethod = "stop")
    public SocketIOServer socketIOServer(AuthTokenListener authTokenListener) {
        com.corundumstudio.socketio.Configuration config = new com.corundumstudio.socketio.Configuration();
        int cores = Runtime.getRuntime().availableProcessors();

        config.setHostname(host);
        config.setPort(port);

        config.setBossThreads(1);
        config.setWorkerThreads(cores * 2);

        config.setPingInterval(pingInterval);
        config.setPingTimeout(pingTimeout);

        config.setMaxFramePayloadLength(maxFramePayload);
        config.setMaxHttpContentLength(maxFramePayload);
        config.setTransports(Transport.WEBSOCKET, Transport.POLLING);

        if (!origin.isBlank()) {
            config.setOrigin(origin);
        }

        SocketConfig socketConfig = new SocketConfig();
        socketConfig.setReuseAddress(true);
        socketConfig.setTcpNoDelay(true);
        config.setSocketConfig(socketConfig);

        config.setJsonSupport(new JacksonJsonSupport(new JavaTimeModule()));
        config.setStoreFactory(new MemoryStoreFactory());

        SocketIOServer server = new SocketIOServer(config);

        server.addConnectListener(client ->
                log.debug("[CONNECT] engine session opened - clientId={}", client.getSessionId()));
        server.addDisconnectListener(client ->
                log.debug("[DISCONNECT] engine session closed - clientId={} transport={}",
                        client.getSessionId(), client.getTransport()));

        server.getNamespace(Namespace.DEFAULT_NAME)
                .addAuthTokenListener(authTokenListener);

        log.info("Socket.IO server configured on {}:{} (worker={}, maxFrame={})",
                host, port, config.getWorkerThreads(), maxFramePayload);
        return server;
    }
}
