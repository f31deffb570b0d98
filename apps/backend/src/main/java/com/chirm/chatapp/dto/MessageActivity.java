package com.chirm.chatapp.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * 새 메시지 알림용 요약 (message.activity).
 * 채널을 보고 있지 않은 클라이언트가 미읽음 표시와 알림에 사용한다.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MessageActivity(
        String channelId,
        String channelName,
        String authorId,
        String author,
        String preview,
        String messageId
) {

    public static final int PREVIEW_LENGTH = 120;
    private static final String ELLIPSIS = "…";

    public static MessageActivity of(String channelId, String channelName, String authorId, String author,
                                     String content, String messageId) {
        return new MessageActivity(channelId, channelName, authorId, author, preview(content), messageId);
    }

    // 서로게이트 쌍이 잘리지 않도록 code point 기준으로 자른다
    static String preview(String content) {
        if (content == null) {
            return "";
        }
        if (content.codePointCount(0, content.length()) <= PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, content.offsetByCodePoints(0, PREVIEW_LENGTH)) + ELLIPSIS;
    }
}
