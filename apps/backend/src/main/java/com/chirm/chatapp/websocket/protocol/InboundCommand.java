package com.chirm.chatapp.websocket.protocol;

/**
 * 클라이언트가 보낸 명령의 data 부분.
 */
public interface InboundCommand {

    /**
     * 필수 필드가 채워져 있는지 확인한다.
     */
    boolean isValid();
}
