package com.chirm.chatapp.websocket.socketio.broadcast;

/**
 * 서버 -> 클라이언트 이벤트 브로드캐스트 서비스 인터페이스.
 *
 * 저장 계층(메시지, 채널, 리액션 등)이 쓰기 성공 후 결과를 전파할 때 사용한다.
 * 현재 구현은 단일 프로세스 Hub 로 직접 전달한다.
 */
public interface BroadcastService {

    /**
     * 연결된 모든 클라이언트에게 전송
     *
     * @param type 프레임 type 태그
     * @param data 전송할 데이터
     */
    void broadcast(String type, Object data);

    /**
     * 해당 텍스트 채널을 보고 있는 클라이언트에게 전송
     *
     * @param channelId 대상 채널 ID
     * @param type      프레임 type 태그
     * @param data      전송할 데이터
     */
    void broadcastToChannel(String channelId, String type, Object data);

    /**
     * 특정 사용자의 모든 연결에 전송
     */
    void sendToUser(String userId, String type, Object data);

    /**
     * 음성 방 참가자 전체에 전송
     */
    void broadcastToRoom(String channelId, String type, Object data);
}
