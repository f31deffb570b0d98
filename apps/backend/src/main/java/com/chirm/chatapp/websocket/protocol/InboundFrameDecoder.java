package com.chirm.chatapp.websocket.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * {"type": ..., "data": ...} 프레임을 타입이 있는 명령으로 변환한다.
 *
 * 깨진 JSON, 모르는 type, 필수 필드 누락은 모두 empty 로 처리된다.
 * 잘못된 프레임 하나 때문에 연결을 끊지 않는다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InboundFrameDecoder {

    private final ObjectMapper objectMapper;

    public Optional<DecodedCommand> decode(String frame) {
        if (frame == null || frame.isBlank()) {
            return Optional.empty();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(frame);
        } catch (JsonProcessingException e) {
            log.debug("Discarding malformed frame: {}", e.getOriginalMessage());
            return Optional.empty();
        }
        if (root == null || !root.isObject()) {
            return Optional.empty();
        }

        Optional<InboundCommandType> type = InboundCommandType.fromTag(root.path("type").asText(null));
        if (type.isEmpty()) {
            log.debug("Discarding frame with unknown type: {}", root.path("type"));
            return Optional.empty();
        }

        JsonNode data = root.get("data");
        if (data == null || !data.isObject()) {
            log.debug("Discarding frame without data object - type: {}", type.get().getTag());
            return Optional.empty();
        }

        try {
            InboundCommand command = objectMapper.treeToValue(data, type.get().getPayloadType());
            if (!command.isValid()) {
                log.debug("Discarding frame with missing fields - type: {}", type.get().getTag());
                return Optional.empty();
            }
            return Optional.of(new DecodedCommand(type.get(), command));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.debug("Discarding frame with invalid data - type: {}, cause: {}", type.get().getTag(), e.getMessage());
            return Optional.empty();
        }
    }
}
