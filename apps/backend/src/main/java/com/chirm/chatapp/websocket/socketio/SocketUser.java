package com.chirm.chatapp.websocket.socketio;

/**
 * 핸드셰이크 인증 후 SocketIOClient 에 저장되는 사용자 정보.
 */
public record SocketUser(String id, String socketId) {
}
