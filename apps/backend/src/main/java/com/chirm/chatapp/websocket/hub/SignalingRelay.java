package com.chirm.chatapp.websocket.hub;

import com.chirm.chatapp.websocket.protocol.VoiceEvents;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * WebRTC 시그널링 중계.
 *
 * 보낸 사람과 대상이 같은 음성 방에 있을 때만 대상 사용자에게 전달한다.
 * 조건을 만족하지 않으면 응답 없이 버린다 (방 참가 여부를 비참가자에게 노출하지 않기 위함).
 *
 * 검사와 전송은 원자적이지 않다. 검사 직후 대상이 방을 나가면
 * 오래된 시그널이 전달될 수 있으나 WebRTC 협상 쪽에서 무시된다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SignalingRelay {

    private final Hub hub;
    private final VoiceRoomRegistry voiceRooms;

    /**
     * @return 전달했으면 true, 버렸으면 false
     */
    public boolean relay(Connection sender, String channelId, String targetUserId, String signalType, JsonNode payload) {
        if (channelId == null || targetUserId == null) {
            return false;
        }
        if (!voiceRooms.areCoMembers(channelId, sender.getUserId(), targetUserId)) {
            log.debug("[RELAY] dropped - type={} channelId={} from={} to={}",
                    signalType, channelId, sender.getUserId(), targetUserId);
            return false;
        }
        hub.sendToUser(targetUserId, VoiceEvents.signal(signalType, channelId, sender.getUserId(), payload));
        return true;
    }
}
