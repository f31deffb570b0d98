package com.chirm.chatapp.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * channel_id 하나만 갖는 명령 (subscribe, typing, voice.join, voice.leave).
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChannelCommand(@JsonProperty("channel_id") String channelId) implements InboundCommand {

    public boolean hasChannel() {
        return channelId != null && !channelId.isBlank();
    }

    @Override
    public boolean isValid() {
        return hasChannel();
    }
}
