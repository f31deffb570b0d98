package com.chirm.chatapp.websocket.hub;

import java.io.IOException;

/**
 * 연결 하나의 실제 전송 계층.
 * Connection 의 writer 만 write 를 호출하므로 구현체는 동시 호출을 고려하지 않아도 된다.
 */
public interface FrameTransport {

    void write(EncodedFrame frame) throws IOException;

    /**
     * 전송 계층을 닫는다. 여러 번 호출될 수 있다.
     */
    void close();
}
