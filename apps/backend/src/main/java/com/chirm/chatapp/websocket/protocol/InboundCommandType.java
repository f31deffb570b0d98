package com.chirm.chatapp.websocket.protocol;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * 서버가 처리하는 inbound 명령 목록.
 * 각 type 태그는 고유한 data 타입을 갖는다.
 */
@Getter
@RequiredArgsConstructor
public enum InboundCommandType {
    SUBSCRIBE(EventTypes.SUBSCRIBE, SubscribeCommand.class),
    TYPING(EventTypes.TYPING, ChannelCommand.class),
    VOICE_JOIN(EventTypes.VOICE_JOIN, ChannelCommand.class),
    VOICE_LEAVE(EventTypes.VOICE_LEAVE, ChannelCommand.class),
    VOICE_OFFER(EventTypes.VOICE_OFFER, SignalCommand.class),
    VOICE_ANSWER(EventTypes.VOICE_ANSWER, SignalCommand.class),
    VOICE_ICE(EventTypes.VOICE_ICE, SignalCommand.class),
    VOICE_MEDIA_STATE(EventTypes.VOICE_MEDIA_STATE, MediaStateCommand.class);

    private static final Map<String, InboundCommandType> BY_TAG = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(InboundCommandType::getTag, Function.identity()));

    private final String tag;
    private final Class<? extends InboundCommand> payloadType;

    public static Optional<InboundCommandType> fromTag(String tag) {
        return Optional.ofNullable(tag).map(BY_TAG::get);
    }
}
