package com.chirm.chatapp.service;

import static com.chirm.chatapp.websocket.protocol.EventTypes.*;

import com.chirm.chatapp.dto.MessageActivity;
import com.chirm.chatapp.websocket.socketio.broadcast.BroadcastService;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import java.util.Objects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * 저장 계층 쓰기 결과를 실시간 이벤트로 전파한다.
 *
 * 채널 단위 이벤트(메시지, 리액션)는 해당 채널을 보고 있는 연결에만,
 * 서버 구조 이벤트(채널, 카테고리, 멤버, 이모지)는 모든 연결에 전달한다.
 * 페이로드는 호출자가 만든 객체를 그대로 직렬화한다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChatEventPublisher {

    private final BroadcastService broadcastService;

    public void messageCreated(String channelId, Object message, MessageActivity activity) {
        Objects.requireNonNull(activity, "activity");
        broadcastService.broadcastToChannel(channelId, MESSAGE_NEW, message);
        broadcastService.broadcast(MESSAGE_ACTIVITY, activity);
        log.debug("Message published - channelId: {}, messageId: {}", channelId, activity.messageId());
    }

    public void messageEdited(String channelId, Object message) {
        broadcastService.broadcastToChannel(channelId, MESSAGE_EDIT, message);
    }

    public void messageDeleted(String channelId, String messageId) {
        broadcastService.broadcastToChannel(channelId, MESSAGE_DELETE, new MessageRef(messageId, channelId));
    }

    /**
     * @param reactions 재계산된 전체 리액션 목록
     */
    public void reactionUpdated(String channelId, Object reactions) {
        broadcastService.broadcastToChannel(channelId, REACTION_UPDATE, reactions);
    }

    public void channelCreated(Object channel) {
        broadcastService.broadcast(CHANNEL_NEW, channel);
    }

    public void channelUpdated(Object channel) {
        broadcastService.broadcast(CHANNEL_UPDATE, channel);
    }

    public void channelDeleted(String channelId) {
        broadcastService.broadcast(CHANNEL_DELETE, new IdRef(channelId));
    }

    public void channelsReordered(Object channels) {
        broadcastService.broadcast(CHANNELS_REORDER, channels);
    }

    public void categoryCreated(Object category) {
        broadcastService.broadcast(CATEGORY_NEW, category);
    }

    public void categoriesUpdated(Object categories) {
        broadcastService.broadcast(CATEGORIES_UPDATE, categories);
    }

    /**
     * @param channels 삭제 후 카테고리가 해제된 채널 목록
     */
    public void categoryDeleted(String categoryId, Object channels) {
        broadcastService.broadcast(CATEGORY_DELETE, new CategoryDeleted(categoryId, channels));
    }

    public void memberJoined(Object member) {
        broadcastService.broadcast(MEMBER_NEW, member);
    }

    public void emojiCreated(Object emoji) {
        broadcastService.broadcast(EMOJI_NEW, emoji);
    }

    public void emojiDeleted(String emojiId) {
        broadcastService.broadcast(EMOJI_DELETE, new IdRef(emojiId));
    }

    public record IdRef(String id) {
    }

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record MessageRef(String id, String channelId) {
    }

    public record CategoryDeleted(String id, Object channels) {
    }
}
