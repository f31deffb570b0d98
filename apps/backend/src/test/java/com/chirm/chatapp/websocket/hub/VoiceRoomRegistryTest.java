package com.chirm.chatapp.websocket.hub;

import static com.chirm.chatapp.websocket.hub.TestConnections.connection;
import static org.assertj.core.api.Assertions.assertThat;

import com.chirm.chatapp.websocket.hub.VoiceRoomRegistry.JoinResult;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class VoiceRoomRegistryTest {

    private final VoiceRoomRegistry registry = new VoiceRoomRegistry();

    @Test
    void joinReportsUsersAlreadyPresent() {
        Connection c1 = connection("c1", "u1");
        Connection c2 = connection("c2", "u2");

        JoinResult first = registry.join("general-voice", c1);
        JoinResult second = registry.join("general-voice", c2);

        assertThat(first.existingUserIds()).isEmpty();
        assertThat(first.newlyJoined()).isTrue();
        assertThat(second.existingUserIds()).containsExactly("u1");
        assertThat(second.newlyJoined()).isTrue();
    }

    @Test
    void rejoinIsNotNewlyJoined() {
        Connection c1 = connection("c1", "u1");
        registry.join("general-voice", c1);

        JoinResult again = registry.join("general-voice", c1);

        assertThat(again.newlyJoined()).isFalse();
        assertThat(registry.members("general-voice")).containsExactly(c1);
    }

    @Test
    void secondDeviceOfSameUserDoesNotSeeItself() {
        Connection phone = connection("phone", "u1");
        Connection laptop = connection("laptop", "u1");
        Connection other = connection("c3", "u3");
        registry.join("general-voice", phone);
        registry.join("general-voice", other);

        JoinResult result = registry.join("general-voice", laptop);

        assertThat(result.existingUserIds()).containsExactly("u3");
    }

    @Test
    void leavePrunesEmptyRoom() {
        Connection c1 = connection("c1", "u1");
        registry.join("general-voice", c1);

        assertThat(registry.leave("general-voice", c1)).isTrue();
        assertThat(registry.leave("general-voice", c1)).isFalse();
        assertThat(registry.snapshot()).doesNotContainKey("general-voice");
        assertThat(registry.roomCount()).isZero();
    }

    @Test
    void leaveOfNonMemberDoesNothing() {
        Connection c1 = connection("c1", "u1");
        Connection c2 = connection("c2", "u2");
        registry.join("general-voice", c1);

        assertThat(registry.leave("general-voice", c2)).isFalse();
        assertThat(registry.leave("unknown", c1)).isFalse();
        assertThat(registry.snapshot()).containsOnlyKeys("general-voice");
    }

    @Test
    void leaveAllReturnsEveryAffectedRoom() {
        Connection c1 = connection("c1", "u1");
        Connection c2 = connection("c2", "u2");
        registry.join("r1", c1);
        registry.join("r2", c1);
        registry.join("r2", c2);

        List<String> affected = registry.leaveAll(c1);

        assertThat(affected).containsExactlyInAnyOrder("r1", "r2");
        assertThat(registry.snapshot()).containsOnlyKeys("r2");
        assertThat(registry.snapshot().get("r2")).containsExactly("u2");
        assertThat(registry.leaveAll(c1)).isEmpty();
    }

    @Test
    void coMembershipIsPerUserAndPerRoom() {
        Connection c1 = connection("c1", "u1");
        Connection c2 = connection("c2", "u2");
        Connection c3 = connection("c3", "u3");
        registry.join("r1", c1);
        registry.join("r1", c2);
        registry.join("r2", c3);

        assertThat(registry.areCoMembers("r1", "u1", "u2")).isTrue();
        assertThat(registry.areCoMembers("r1", "u1", "u3")).isFalse();
        assertThat(registry.areCoMembers("r2", "u3", "u1")).isFalse();
        assertThat(registry.areCoMembers("missing", "u1", "u2")).isFalse();

        registry.leave("r1", c2);
        assertThat(registry.areCoMembers("r1", "u1", "u2")).isFalse();
    }

    @Test
    void snapshotNeverContainsEmptyRoomsUnderConcurrentChurn() throws Exception {
        int threads = 8;
        int iterations = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int worker = t;
            futures.add(pool.submit(() -> {
                Connection connection = connection("c" + worker, "u" + worker);
                start.await();
                for (int i = 0; i < iterations; i++) {
                    String room = "room-" + (i % 4);
                    registry.join(room, connection);
                    assertThat(registry.snapshot().values()).allMatch(members -> !members.isEmpty());
                    registry.leave(room, connection);
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(30, TimeUnit.SECONDS);
        }
        pool.shutdown();

        assertThat(registry.snapshot()).isEmpty();
        assertThat(registry.roomCount()).isZero();
    }
}
