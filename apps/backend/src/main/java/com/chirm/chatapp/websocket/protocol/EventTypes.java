package com.chirm.chatapp.websocket.protocol;

/**
 * 프레임 JSON 의 type 태그 상수.
 */
public final class EventTypes {

    // Client -> Server
    public static final String SUBSCRIBE = "subscribe";
    public static final String TYPING = "typing";
    public static final String VOICE_JOIN = "voice.join";
    public static final String VOICE_LEAVE = "voice.leave";
    public static final String VOICE_OFFER = "voice.offer";
    public static final String VOICE_ANSWER = "voice.answer";
    public static final String VOICE_ICE = "voice.ice";
    public static final String VOICE_MEDIA_STATE = "voice.media_state";

    // Server -> Client (voice)
    public static final String VOICE_ROOM_STATE = "voice.room_state";
    public static final String VOICE_JOINED = "voice.joined";
    public static final String VOICE_LEFT = "voice.left";

    // Server -> Client (producer events)
    public static final String MESSAGE_NEW = "message.new";
    public static final String MESSAGE_ACTIVITY = "message.activity";
    public static final String MESSAGE_EDIT = "message.edit";
    public static final String MESSAGE_DELETE = "message.delete";
    public static final String REACTION_UPDATE = "reaction.update";
    public static final String CHANNEL_NEW = "channel.new";
    public static final String CHANNEL_UPDATE = "channel.update";
    public static final String CHANNEL_DELETE = "channel.delete";
    public static final String CHANNELS_REORDER = "channels.reorder";
    public static final String CATEGORY_NEW = "category.new";
    public static final String CATEGORIES_UPDATE = "categories.update";
    public static final String CATEGORY_DELETE = "category.delete";
    public static final String MEMBER_NEW = "member.new";
    public static final String EMOJI_NEW = "emoji.new";
    public static final String EMOJI_DELETE = "emoji.delete";

    private EventTypes() {
    }
}
