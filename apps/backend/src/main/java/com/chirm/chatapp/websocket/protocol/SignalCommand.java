package com.chirm.chatapp.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * WebRTC 시그널링 (offer / answer / ice).
 * payload 는 해석하지 않고 그대로 전달한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalCommand(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("target_user_id") String targetUserId,
        @JsonProperty("payload") JsonNode payload
) implements InboundCommand {

    @Override
    public boolean isValid() {
        return targetUserId != null && !targetUserId.isBlank();
    }
}
