package com.chirm.chatapp.websocket.socketio;

import com.chirm.chatapp.service.JwtService;
import com.corundumstudio.socketio.AuthTokenListener;
import com.corundumstudio.socketio.AuthTokenResult;
import com.corundumstudio.socketio.SocketIOClient;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.stereotype.Component;

/**
 * Socket.IO Authorization Handler
 * socket.handshake.auth.token (없으면 ?token= 쿼리 파라미터)을 검증한다.
 *
 * 인증에 실패하면 연결 자체가 거절되어 Hub 에 등록되지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "socketio.enabled", havingValue = "true", matchIfMissing = true)
public class AuthTokenListenerImpl implements AuthTokenListener {

    public static final String USER_KEY = "user";

    private final JwtService jwtService;

    @Override
    public AuthTokenResult getAuthTokenResult(Object authPayload, SocketIOClient client) {
        String token = resolveToken(authPayload, client);
        if (token == null || token.isBlank()) {
            log.debug("[AUTH] missing token - sessionId={}", client.getSessionId());
            return new AuthTokenResult(false, Map.of("message", "unauthorized"));
        }

        final String userId;
        try {
            userId = jwtService.extractUserId(token);
        } catch (JwtException e) {
            log.debug("[AUTH] invalid token - sessionId={} cause={}", client.getSessionId(), e.getMessage());
            return new AuthTokenResult(false, Map.of("message", "unauthorized"));
        }

        client.set(USER_KEY, new SocketUser(userId, client.getSessionId().toString()));
        return AuthTokenResult.AuthTokenResultSuccess;
    }

    private String resolveToken(Object authPayload, SocketIOClient client) {
        if (authPayload instanceof Map<?, ?> raw && raw.get("token") instanceof String token) {
            return token;
        }
        if (client.getHandshakeData() == null) {
            return null;
        }
        return client.getHandshakeData().getSingleUrlParam("token");
    }
}
