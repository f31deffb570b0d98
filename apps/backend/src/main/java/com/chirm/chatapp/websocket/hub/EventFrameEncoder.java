package com.chirm.chatapp.websocket.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class EventFrameEncoder {

    private final ObjectMapper objectMapper;

    /**
     * 이벤트를 프레임 텍스트로 직렬화한다.
     * 직렬화 실패 시 empty 를 반환하고 해당 이벤트는 전달되지 않는다.
     */
    public Optional<EncodedFrame> encode(WsEvent event) {
        try {
            return Optional.of(new EncodedFrame(event.type(), objectMapper.writeValueAsString(event)));
        } catch (JsonProcessingException e) {
            log.error("Event serialization failed - type: {}", event.type(), e);
            return Optional.empty();
        }
    }
}
