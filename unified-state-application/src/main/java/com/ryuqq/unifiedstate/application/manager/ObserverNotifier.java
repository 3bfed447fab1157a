package com.ryuqq.unifiedstate.application.manager;

import com.ryuqq.unifiedstate.core.model.StateEvent;
import com.ryuqq.unifiedstate.core.spi.StateObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Observer 알림 전파기.
 *
 * <p>각 (Observer, Event) 쌍을 고정 크기 스레드 풀의 개별 작업으로 제출합니다.</p>
 *
 * <p><strong>보장 사항:</strong></p>
 * <ul>
 *   <li>호출자는 블로킹되지 않음 (큐가 가득 차면 해당 알림을 버리고 경고 로그)</li>
 *   <li>Observer 예외는 작업 단위로 격리되어 로그만 남김</li>
 *   <li>동시 실행 수는 observerThreads로 제한</li>
 * </ul>
 *
 * <p><strong>비보장 사항:</strong> 전달 확인, 재시도, Observer 간 순서, 프로세스 종료 시 유실 방지.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ObserverNotifier {

    private static final Logger log = LoggerFactory.getLogger(ObserverNotifier.class);

    private final ThreadPoolExecutor executor;
    private final AtomicLong droppedNotifications = new AtomicLong();

    /**
     * 생성자.
     *
     * @param config 매니저 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public ObserverNotifier(StateManagerConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        AtomicInteger threadIndex = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(
            config.observerThreads(),
            config.observerThreads(),
            0L,
            TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(config.observerQueueCapacity()),
            runnable -> {
                Thread thread = new Thread(runnable, "state-observer-" + threadIndex.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            },
            new ThreadPoolExecutor.AbortPolicy()
        );
    }

    /**
     * 활성 Observer 각각에 이벤트 전달 작업을 제출.
     *
     * @param observers 대상 Observer 스냅샷
     * @param event 전달할 이벤트
     */
    public void notify(List<StateObserver> observers, StateEvent event) {
        for (StateObserver observer : observers) {
            if (!observer.isActive()) {
                continue;
            }
            try {
                executor.execute(() -> deliver(observer, event));
            } catch (RejectedExecutionException e) {
                droppedNotifications.incrementAndGet();
                log.warn("Dropped notification of event {} for observer {}: queue full or notifier closed",
                    event.id(), observer.getId());
            }
        }
    }

    /**
     * 큐 포화 또는 종료로 버려진 알림 수 조회.
     *
     * @return 누적 드롭 수
     */
    public long droppedNotifications() {
        return droppedNotifications.get();
    }

    /**
     * 알림 풀 종료.
     *
     * <p>대기 중인 알림이 처리되도록 잠시 기다린 후, 시간 내 끝나지 않으면 강제 종료합니다.</p>
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static void deliver(StateObserver observer, StateEvent event) {
        try {
            observer.onStateChange(event);
        } catch (Exception e) {
            log.error("Observer {} failed to handle event {} ({} {}:{})",
                observer.getId(), event.id(), event.type(), event.stateType().id(), event.stateId(), e);
        } catch (Error e) {
            log.error("Observer {} raised an error for event {}", observer.getId(), event.id(), e);
        }
    }
}
