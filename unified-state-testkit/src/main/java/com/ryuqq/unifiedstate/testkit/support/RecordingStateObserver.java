package com.ryuqq.unifiedstate.testkit.support;

import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.model.StateEventType;
import com.ryuqq.unifiedstate.core.spi.StateObserver;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * 수신한 이벤트를 기록하는 테스트용 Observer.
 *
 * <p>알림은 별도 스레드에서 도착하므로 {@link #awaitEvents(int, Duration)}로 도착을 기다린 후 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class RecordingStateObserver implements StateObserver {

    private final String id;
    private final List<StateEvent> events = new CopyOnWriteArrayList<>();
    private volatile boolean active = true;

    public RecordingStateObserver(String id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        this.id = id;
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    /**
     * 활성 여부 변경 (비활성 Observer는 알림 대상에서 제외됨).
     */
    public void setActive(boolean active) {
        this.active = active;
    }

    @Override
    public void onStateChange(StateEvent event) {
        events.add(event);
        synchronized (this) {
            notifyAll();
        }
    }

    /**
     * 수신한 이벤트 목록 (도착 순).
     */
    public List<StateEvent> events() {
        return List.copyOf(events);
    }

    /**
     * 특정 종류의 이벤트만 조회.
     */
    public List<StateEvent> events(StateEventType type) {
        return events.stream()
            .filter(event -> event.type() == type)
            .collect(Collectors.toList());
    }

    /**
     * 최소 {@code count}개의 이벤트가 도착할 때까지 대기.
     *
     * @param count 기대 이벤트 수
     * @param timeout 최대 대기 시간
     * @return 시간 내 도착했으면 true
     * @throws InterruptedException 대기 중 인터럽트된 경우
     */
    public synchronized boolean awaitEvents(int count, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (events.size() < count) {
            long remainingMs = (deadline - System.nanoTime()) / 1_000_000L;
            if (remainingMs <= 0) {
                return false;
            }
            wait(remainingMs);
        }
        return true;
    }

    /**
     * 기록 초기화.
     */
    public void clear() {
        events.clear();
    }
}
