package com.chirm.chatapp.websocket.hub;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.springframework.stereotype.Component;

/**
 * 음성/영상 방 참가자 레지스트리.
 *
 * - channelId -> 방에 들어와 있는 연결 집합
 * - 프로세스 메모리에만 존재하며 재시작 시 비어 있는 상태로 시작한다.
 * - 멤버십은 연결 단위로 관리하지만 co-member 판정은 사용자 단위로 한다.
 *
 * 모든 변경 연산이 끝난 뒤 빈 방 엔트리는 남지 않는다.
 */
@Component
public class VoiceRoomRegistry {

    private final Map<String, Set<Connection>> rooms = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 방에 연결을 추가한다.
     *
     * @return 이미 방에 있던 다른 사용자 ID 목록과 신규 입장 여부
     */
    public JoinResult join(String channelId, Connection connection) {
        lock.writeLock().lock();
        try {
            Set<Connection> members = rooms.computeIfAbsent(channelId, k -> new LinkedHashSet<>());
            Set<String> existing = new LinkedHashSet<>();
            for (Connection member : members) {
                if (member != connection && !member.getUserId().equals(connection.getUserId())) {
                    existing.add(member.getUserId());
                }
            }
            boolean newlyJoined = members.add(connection);
            return new JoinResult(List.copyOf(existing), newlyJoined);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @return 실제로 방에 있었으면 true
     */
    public boolean leave(String channelId, Connection connection) {
        lock.writeLock().lock();
        try {
            Set<Connection> members = rooms.get(channelId);
            if (members == null || !members.remove(connection)) {
                return false;
            }
            if (members.isEmpty()) {
                rooms.remove(channelId);
            }
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * 연결을 모든 방에서 제거한다. 연결 종료 시 사용.
     *
     * @return 연결이 속해 있던 방 ID 목록
     */
    public List<String> leaveAll(Connection connection) {
        List<String> affected = new ArrayList<>();
        lock.writeLock().lock();
        try {
            Iterator<Map.Entry<String, Set<Connection>>> it = rooms.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, Set<Connection>> entry = it.next();
                if (entry.getValue().remove(connection)) {
                    affected.add(entry.getKey());
                    if (entry.getValue().isEmpty()) {
                        it.remove();
                    }
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        return affected;
    }

    /**
     * 두 사용자 모두 해당 방에 연결을 하나 이상 갖고 있는지 확인한다.
     * 결과는 캐시하지 않는다.
     */
    public boolean areCoMembers(String channelId, String userA, String userB) {
        lock.readLock().lock();
        try {
            Set<Connection> members = rooms.get(channelId);
            if (members == null) {
                return false;
            }
            boolean foundA = false;
            boolean foundB = false;
            for (Connection member : members) {
                foundA |= member.getUserId().equals(userA);
                foundB |= member.getUserId().equals(userB);
            }
            return foundA && foundB;
        } finally {
            lock.readLock().unlock();
        }
    }

    public boolean contains(String channelId, Connection connection) {
        lock.readLock().lock();
        try {
            Set<Connection> members = rooms.get(channelId);
            return members != null && members.contains(connection);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Connection> members(String channelId) {
        lock.readLock().lock();
        try {
            Set<Connection> members = rooms.get(channelId);
            return members == null ? List.of() : List.copyOf(members);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * channelId -> userId 목록 스냅샷.
     */
    public Map<String, List<String>> snapshot() {
        lock.readLock().lock();
        try {
            Map<String, List<String>> out = new LinkedHashMap<>();
            rooms.forEach((channelId, members) -> {
                List<String> userIds = new ArrayList<>(members.size());
                members.forEach(member -> userIds.add(member.getUserId()));
                out.put(channelId, userIds);
            });
            return out;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int roomCount() {
        lock.readLock().lock();
        try {
            return rooms.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public record JoinResult(List<String> existingUserIds, boolean newlyJoined) {
    }
}
