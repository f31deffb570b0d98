package com.chirm.chatapp.websocket.protocol;

import com.chirm.chatapp.websocket.hub.WsEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.List;

/**
 * 음성 방 관련 서버 -> 클라이언트 이벤트 생성기.
 */
public final class VoiceEvents {

    private VoiceEvents() {
    }

    public static WsEvent roomState(String channelId, List<String> participants) {
        return WsEvent.of(EventTypes.VOICE_ROOM_STATE, new RoomState(channelId, participants));
    }

    public static WsEvent joined(String channelId, String userId) {
        return WsEvent.of(EventTypes.VOICE_JOINED, new Presence(channelId, userId));
    }

    public static WsEvent left(String channelId, String userId) {
        return WsEvent.of(EventTypes.VOICE_LEFT, new Presence(channelId, userId));
    }

    public static WsEvent signal(String type, String channelId, String fromUserId, JsonNode payload) {
        return WsEvent.of(type, new Signal(channelId, fromUserId, payload));
    }

    public static WsEvent mediaState(String channelId, String fromUserId, boolean camEnabled, boolean screenSharing) {
        return WsEvent.of(EventTypes.VOICE_MEDIA_STATE,
                new MediaState(channelId, fromUserId, camEnabled, screenSharing));
    }

    public static WsEvent typing(String channelId, String userId) {
        return WsEvent.of(EventTypes.TYPING, new Typing(userId, channelId));
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record RoomState(String channelId, List<String> participants) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Presence(String channelId, String userId) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Signal(String channelId, String fromUserId, JsonNode payload) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MediaState(String channelId, String fromUserId, boolean camEnabled, boolean screenSharing) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Typing(String userId, String channelId) {
    }
}
