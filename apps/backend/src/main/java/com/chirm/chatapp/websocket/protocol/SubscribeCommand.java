package com.chirm.chatapp.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 보고 있는 채널 변경. 빈 channel_id 는 구독 해제로 취급한다.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscribeCommand(@JsonProperty("channel_id") String channelId) implements InboundCommand {

    @Override
    public boolean isValid() {
        return true;
    }
}
