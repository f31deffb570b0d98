package com.chirm.chatapp.websocket.hub;

import com.chirm.chatapp.websocket.protocol.VoiceEvents;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 실시간 이벤트 라우터.
 *
 * "누가 연결되어 있는가"와 "어떻게 전달하는가"의 단일 진입점.
 *
 * [전달 패턴]
 * - broadcast: 모든 연결
 * - broadcastToChannel: 해당 채널을 보고 있는 연결
 * - broadcastToRoom: 음성 방 참가 연결 (선택적으로 한 연결 제외)
 * - sendToUser: 특정 사용자의 모든 연결 (멀티 디바이스)
 *
 * [동시성]
 * - 전역 연결 집합은 자체 read/write lock, 방 레지스트리는 별도 lock 으로 보호된다.
 * - 전송은 큐에 대한 non-blocking offer 이므로 느린 소비자가 다른 연결을 막지 않는다.
 * - 큐가 가득 찬 연결은 read lock 아래에서 수집만 하고, lock 을 놓은 뒤 write lock 으로 제거한다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class Hub {

    private final VoiceRoomRegistry voiceRooms;
    private final EventFrameEncoder encoder;

    private final Set<Connection> connections = new LinkedHashSet<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public void register(Connection connection) {
        lock.writeLock().lock();
        try {
            connections.add(connection);
        } finally {
            lock.writeLock().unlock();
        }
        connection.activate();
        log.info("[REGISTER] connectionId={} userId={}", connection.getId(), connection.getUserId());
    }

    /**
     * 연결을 해제한다. 여러 번 호출해도 결과는 한 번 호출한 것과 같다.
     *
     * 1. 전역 집합에서 제거 (write lock)
     * 2. outbound 큐 닫기 (최초 1회)
     * 3. 참가 중이던 모든 음성 방에서 퇴장 + 방마다 voice.left 1회
     *
     * @return 이번 호출로 전역 집합에서 제거되었으면 true
     */
    public boolean unregister(Connection connection) {
        boolean removed;
        lock.writeLock().lock();
        try {
            removed = connections.remove(connection);
        } finally {
            lock.writeLock().unlock();
        }

        connection.closeOutbound();

        List<String> affected = voiceRooms.leaveAll(connection);
        for (String channelId : affected) {
            announceVoiceLeft(channelId, connection.getUserId());
        }

        if (removed) {
            log.info("[UNREGISTER] connectionId={} userId={} leftRooms={}",
                    connection.getId(), connection.getUserId(), affected);
        }
        return removed;
    }

    public void broadcast(WsEvent event) {
        deliverToRegistered(event, connection -> true);
    }

    public void broadcastToChannel(String channelId, WsEvent event) {
        deliverToRegistered(event, connection -> connection.isViewing(channelId));
    }

    public void sendToUser(String userId, WsEvent event) {
        deliverToRegistered(event, connection -> connection.getUserId().equals(userId));
    }

    /**
     * 음성 방 참가자에게 전달한다.
     *
     * @param exclude 제외할 연결 (보낸 사람 본인), 없으면 null
     */
    public void broadcastToRoom(String channelId, WsEvent event, Connection exclude) {
        List<Connection> members = voiceRooms.members(channelId);
        if (members.isEmpty()) {
            return;
        }
        Optional<EncodedFrame> frame = encoder.encode(event);
        if (frame.isEmpty()) {
            return;
        }
        List<Connection> dead = new ArrayList<>();
        for (Connection member : members) {
            if (member == exclude) {
                continue;
            }
            if (!member.offer(frame.get())) {
                dead.add(member);
            }
        }
        evict(dead, event.type());
    }

    /**
     * 단일 연결에 대한 직접 응답.
     */
    public void sendTo(Connection connection, WsEvent event) {
        encoder.encode(event).ifPresent(frame -> {
            if (!connection.offer(frame)) {
                evict(List.of(connection), event.type());
            }
        });
    }

    /**
     * 방 전체와 서버 전체에 voice.left 를 알린다.
     */
    public void announceVoiceLeft(String channelId, String userId) {
        WsEvent left = VoiceEvents.left(channelId, userId);
        broadcastToRoom(channelId, left, null);
        broadcast(left);
    }

    public int connectionCount() {
        lock.readLock().lock();
        try {
            return connections.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    boolean isRegistered(Connection connection) {
        lock.readLock().lock();
        try {
            return connections.contains(connection);
        } finally {
            lock.readLock().unlock();
        }
    }

    private void deliverToRegistered(WsEvent event, Predicate<Connection> audience) {
        Optional<EncodedFrame> frame = encoder.encode(event);
        if (frame.isEmpty()) {
            return;
        }

        List<Connection> dead = new ArrayList<>();
        lock.readLock().lock();
        try {
            for (Connection connection : connections) {
                if (audience.test(connection) && !connection.offer(frame.get())) {
                    dead.add(connection);
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        evict(dead, event.type());
    }

    // read lock 을 놓은 뒤에만 호출된다
    private void evict(List<Connection> dead, String eventType) {
        for (Connection connection : dead) {
            // 이미 닫힌 큐는 종료 중인 연결이므로 경고 없이 정리만 한다
            if (!connection.isOutboundClosed()) {
                log.warn("[EVICT] outbound queue full - connectionId={} userId={} eventType={}",
                        connection.getId(), connection.getUserId(), eventType);
            }
            unregister(connection);
        }
    }
}
