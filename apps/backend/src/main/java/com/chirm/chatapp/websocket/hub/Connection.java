package com.chirm.chatapp.websocket.hub;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * 인증된 클라이언트 연결 하나.
 *
 * [소유 관계]
 * - outbound 큐와 전송 계층(FrameTransport)은 이 객체가 소유한다.
 * - 전역 연결 집합 등록/해제는 Hub 만 수행한다.
 *
 * [상태 전이]
 * CONNECTING → ACTIVE → CLOSING → CLOSED
 *
 * outbound 큐는 한 번 닫히면 다시 쓰이지 않는다.
 * offer 와 close 는 같은 모니터로 직렬화되어 close 이후의 offer 는 항상 거절된다.
 */
@Slf4j
public class Connection {

    private static final EncodedFrame END_OF_STREAM = new EncodedFrame("", "");

    @Getter
    private final String id;
    @Getter
    private final String userId;
    private final FrameTransport transport;
    private final BlockingQueue<EncodedFrame> outbound;
    private final Object sendLock = new Object();
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.CONNECTING);
    private final AtomicBoolean writerStarted = new AtomicBoolean(false);

    // 현재 보고 있는 텍스트 채널 (연결당 하나)
    private volatile String viewedChannelId;
    private boolean outboundClosed;

    public Connection(String id, String userId, FrameTransport transport, int queueCapacity) {
        this.id = id;
        this.userId = userId;
        this.transport = transport;
        this.outbound = new LinkedBlockingQueue<>(queueCapacity);
    }

    public String getViewedChannelId() {
        return viewedChannelId;
    }

    public void setViewedChannelId(String channelId) {
        this.viewedChannelId = channelId;
    }

    public boolean isViewing(String channelId) {
        return channelId != null && channelId.equals(viewedChannelId);
    }

    public ConnectionState getState() {
        return state.get();
    }

    void activate() {
        state.compareAndSet(ConnectionState.CONNECTING, ConnectionState.ACTIVE);
    }

    /**
     * 블로킹 없이 프레임을 큐에 넣는다.
     *
     * @return 큐가 가득 찼거나 이미 닫혔으면 false
     */
    boolean offer(EncodedFrame frame) {
        synchronized (sendLock) {
            if (outboundClosed) {
                return false;
            }
            return outbound.offer(frame);
        }
    }

    boolean isOutboundClosed() {
        synchronized (sendLock) {
            return outboundClosed;
        }
    }

    /**
     * outbound 큐를 닫는다. 최초 호출만 효과가 있다.
     *
     * writer 가 이미 돌고 있으면 남은 프레임을 비운 뒤 종료하고,
     * 시작조차 못 한 연결이면 여기서 바로 전송 계층을 닫는다.
     *
     * @return 이번 호출로 닫혔으면 true
     */
    boolean closeOutbound() {
        synchronized (sendLock) {
            if (outboundClosed) {
                return false;
            }
            outboundClosed = true;
            // 큐가 가득 차 있으면 가장 오래된 프레임을 버리고 marker 자리를 만든다.
            // 닫힌 뒤에는 writer 외에 큐를 건드리는 쪽이 없으므로 두 번째 offer 는 항상 성공한다.
            if (!outbound.offer(END_OF_STREAM)) {
                outbound.poll();
                outbound.offer(END_OF_STREAM);
            }
        }
        transitionToClosing();
        if (!writerStarted.get()) {
            state.set(ConnectionState.CLOSED);
            transport.close();
        }
        return true;
    }

    /**
     * writer 를 시작한다.
     *
     * @param executor writer 를 실행할 executor
     * @param onExit   writer 가 종료될 때 호출 (Hub::unregister)
     */
    public void startWriter(Executor executor, Consumer<Connection> onExit) {
        if (!writerStarted.compareAndSet(false, true)) {
            throw new IllegalStateException("Writer already started for connection " + id);
        }
        try {
            executor.execute(() -> writeLoop(onExit));
        } catch (RuntimeException e) {
            writerStarted.set(false);
            throw e;
        }
    }

    private void writeLoop(Consumer<Connection> onExit) {
        try {
            while (true) {
                EncodedFrame frame = outbound.take();
                if (frame == END_OF_STREAM) {
                    break;
                }
                transport.write(frame);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("[WRITE] writer interrupted - connectionId: {}", id);
        } catch (Exception e) {
            log.debug("[WRITE] transport fault - connectionId: {}, userId: {}, cause: {}", id, userId, e.getMessage());
        } finally {
            transitionToClosing();
            state.set(ConnectionState.CLOSED);
            transport.close();
            onExit.accept(this);
        }
    }

    private void transitionToClosing() {
        state.updateAndGet(current -> current == ConnectionState.CLOSED ? current : ConnectionState.CLOSING);
    }

    /**
     * 아직 전송되지 않은 프레임을 꺼낸다. writer 가 없는 연결에서만 의미가 있다.
     */
    List<EncodedFrame> drainPending() {
        List<EncodedFrame> frames = new ArrayList<>();
        outbound.drainTo(frames);
        frames.removeIf(frame -> frame == END_OF_STREAM);
        return frames;
    }

    @Override
    public String toString() {
        return "Connection{id=" + id + ", userId=" + userId + ", state=" + state.get() + "}";
    }
}
