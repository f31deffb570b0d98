package com.chirm.chatapp.websocket.socketio;

/**
 * Socket.IO 이벤트 이름.
 *
 * Socket.IO 레벨 이벤트는 FRAME 하나뿐이며, 실제 이벤트 종류는
 * 프레임 JSON 의 type 필드로 구분한다 (EventTypes).
 */
public final class SocketIOEvents {

    // 양방향
    public static final String FRAME = "frame";

    private SocketIOEvents() {
    }
}
