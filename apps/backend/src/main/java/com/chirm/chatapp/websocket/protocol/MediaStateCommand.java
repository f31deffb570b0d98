package com.chirm.chatapp.websocket.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaStateCommand(
        @JsonProperty("channel_id") String channelId,
        @JsonProperty("cam_enabled") boolean camEnabled,
        @JsonProperty("screen_sharing") boolean screenSharing
) implements InboundCommand {

    @Override
    public boolean isValid() {
        return channelId != null && !channelId.isBlank();
    }
}
