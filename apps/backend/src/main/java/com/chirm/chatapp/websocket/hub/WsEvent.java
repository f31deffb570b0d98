package com.chirm.chatapp.websocket.hub;

/**
 * 클라이언트로 전달되는 이벤트 envelope.
 *
 * 와이어 형식은 {"type": ..., "data": ...} 이며,
 * data 의 구조는 type 에 따라 달라진다.
 */
public record WsEvent(String type, Object data) {

    public static WsEvent of(String type, Object data) {
        return new WsEvent(type, data);
    }
}
