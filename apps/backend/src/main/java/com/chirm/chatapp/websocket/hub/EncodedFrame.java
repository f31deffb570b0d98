package com.chirm.chatapp.websocket.hub;

/**
 * 직렬화가 끝난 프레임.
 * 한 번의 브로드캐스트 대상 전체가 같은 인스턴스를 공유한다.
 */
public record EncodedFrame(String type, String text) {
}
