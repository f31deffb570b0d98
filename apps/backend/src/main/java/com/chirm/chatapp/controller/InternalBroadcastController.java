package com.chirm.chatapp.controller;

import com.chirm.chatapp.dto.BroadcastRequest;
import com.chirm.chatapp.websocket.socketio.broadcast.BroadcastService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 외부 프로세스 producer 용 내부 브로드캐스트 엔드포인트.
 *
 * JWT 체인 밖에 있으며 공유 내부 토큰으로만 보호된다.
 * 토큰 검사를 본문 검증보다 먼저 하므로 토큰이 틀리면 본문과 무관하게 401 이다.
 */
@Tag(name = "내부 (Internal)", description = "내부 서비스 전용 브로드캐스트 API")
@Slf4j
@RestController
@RequestMapping("/internal")
public class InternalBroadcastController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final BroadcastService broadcastService;
    private final Validator validator;
    private final byte[] internalToken;

    public InternalBroadcastController(
            BroadcastService broadcastService,
            Validator validator,
            @Value("${internal.token}") String internalToken
    ) {
        this.broadcastService = broadcastService;
        this.validator = validator;
        this.internalToken = internalToken.getBytes(StandardCharsets.UTF_8);
    }

    @Operation(summary = "이벤트 브로드캐스트", description = "지정한 범위의 연결에 이벤트를 그대로 전달합니다.")
    @ApiResponses({
        @ApiResponse(responseCode = "204", description = "전달 요청 완료"),
        @ApiResponse(responseCode = "400", description = "잘못된 요청 본문"),
        @ApiResponse(responseCode = "401", description = "내부 토큰 불일치")
    })
    @PostMapping("/broadcast")
    public ResponseEntity<Void> broadcast(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            @RequestBody BroadcastRequest request
    ) {
        if (!isAuthorized(authorization)) {
            log.warn("Internal broadcast rejected - invalid token");
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED).build();
        }

        Set<ConstraintViolation<BroadcastRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            log.debug("Internal broadcast rejected - invalid body: {}", violations);
            return ResponseEntity.badRequest().build();
        }

        switch (request.scope()) {
            case GLOBAL -> broadcastService.broadcast(request.type(), request.data());
            case CHANNEL -> broadcastService.broadcastToChannel(request.target(), request.type(), request.data());
            case USER -> broadcastService.sendToUser(request.target(), request.type(), request.data());
            case ROOM -> broadcastService.broadcastToRoom(request.target(), request.type(), request.data());
        }
        log.debug("Internal broadcast - scope: {}, target: {}, type: {}",
                request.scope(), request.target(), request.type());
        return ResponseEntity.noContent().build();
    }

    private boolean isAuthorized(String authorization) {
        if (internalToken.length == 0 || authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return false;
        }
        byte[] presented = authorization.substring(BEARER_PREFIX.length()).getBytes(StandardCharsets.UTF_8);
        return MessageDigest.isEqual(internalToken, presented);
    }
}
