package com.ryuqq.unifiedstate.core.migration;

import com.ryuqq.unifiedstate.core.exception.NoMigrationPathException;
import com.ryuqq.unifiedstate.core.exception.StateMigrationException;
import com.ryuqq.unifiedstate.core.spi.StateMigrator;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * 버전 그래프 기반 Migrator.
 *
 * <p>단일 단계 변환기를 {@code "{from}_to_{to}"} 키로 등록하고, 요청된 버전 쌍에 직접 간선이 없으면
 * 등록된 간선 위에서 너비 우선 탐색으로 최단 경로를 찾아 순서대로 적용합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * VersionedStateMigrator&lt;SessionState&gt; migrator = new VersionedStateMigrator&lt;&gt;(SessionState.class)
 *     .register("v1", "v2", s -&gt; s.withSchemaVersion("v2"))
 *     .register("v2", "v3", s -&gt; s.withSchemaVersion("v3"));
 *
 * migrator.migrateState("v1", "v3", state);   // v1 → v2 → v3
 * migrator.migrateState("v3", "v1", state);   // NoMigrationPathException
 * </pre>
 *
 * <p><strong>동시성:</strong> 등록과 조회는 ReadWriteLock으로 보호되며, 변환기 실행은 락 밖에서 수행됩니다.</p>
 *
 * @param <T> 마이그레이션 대상 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class VersionedStateMigrator<T> implements StateMigrator<T> {

    private final Class<T> valueType;
    private final Map<String, Map<String, UnaryOperator<T>>> edges = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    /**
     * 생성자.
     *
     * @param valueType 마이그레이션 대상 클래스
     * @throws IllegalArgumentException valueType이 null인 경우
     */
    public VersionedStateMigrator(Class<T> valueType) {
        if (valueType == null) {
            throw new IllegalArgumentException("valueType cannot be null");
        }
        this.valueType = valueType;
    }

    /**
     * 단일 단계 변환기 등록 (같은 키는 덮어씀).
     *
     * @param fromVersion 시작 버전
     * @param toVersion 도착 버전
     * @param transformer 변환 함수
     * @return this (체이닝)
     */
    public VersionedStateMigrator<T> register(String fromVersion, String toVersion, UnaryOperator<T> transformer) {
        requireVersion(fromVersion, "fromVersion");
        requireVersion(toVersion, "toVersion");
        if (fromVersion.equals(toVersion)) {
            throw new IllegalArgumentException("fromVersion and toVersion must differ: " + fromVersion);
        }
        if (transformer == null) {
            throw new IllegalArgumentException("transformer cannot be null");
        }

        lock.writeLock().lock();
        try {
            edges.computeIfAbsent(fromVersion, k -> new LinkedHashMap<>()).put(toVersion, transformer);
        } finally {
            lock.writeLock().unlock();
        }
        return this;
    }

    /**
     * 변환기 키 생성.
     *
     * @return {@code "{from}_to_{to}"}
     */
    public static String migrationKey(String fromVersion, String toVersion) {
        return fromVersion + "_to_" + toVersion;
    }

    /**
     * 등록된 변환기 키 목록 조회.
     *
     * @return 등록 순서의 키 목록
     */
    public List<String> registeredKeys() {
        lock.readLock().lock();
        try {
            List<String> keys = new ArrayList<>();
            edges.forEach((from, targets) -> targets.keySet().forEach(to -> keys.add(migrationKey(from, to))));
            return keys;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * 최단 마이그레이션 경로 조회.
     *
     * @param fromVersion 시작 버전
     * @param toVersion 도착 버전
     * @return 방문 순서의 버전 목록 (시작/도착 포함), 경로가 없으면 empty
     */
    public Optional<List<String>> resolvePath(String fromVersion, String toVersion) {
        requireVersion(fromVersion, "fromVersion");
        requireVersion(toVersion, "toVersion");
        if (fromVersion.equals(toVersion)) {
            return Optional.of(List.of(fromVersion));
        }

        lock.readLock().lock();
        try {
            Map<String, String> previous = new HashMap<>();
            Deque<String> queue = new ArrayDeque<>();
            queue.add(fromVersion);
            previous.put(fromVersion, null);

            while (!queue.isEmpty()) {
                String current = queue.poll();
                for (String next : edges.getOrDefault(current, Map.of()).keySet()) {
                    if (previous.containsKey(next)) {
                        continue;
                    }
                    previous.put(next, current);
                    if (next.equals(toVersion)) {
                        return Optional.of(buildPath(previous, toVersion));
                    }
                    queue.add(next);
                }
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Class<T> valueType() {
        return valueType;
    }

    /**
     * {@inheritDoc}
     *
     * <p>from과 to가 같으면 값을 그대로 반환합니다.</p>
     */
    @Override
    public T migrateState(String fromVersion, String toVersion, T value) {
        List<String> path = resolvePath(fromVersion, toVersion)
            .orElseThrow(() -> new NoMigrationPathException(fromVersion, toVersion));

        T current = value;
        for (int i = 0; i < path.size() - 1; i++) {
            String from = path.get(i);
            String to = path.get(i + 1);
            UnaryOperator<T> transformer = transformer(from, to);
            try {
                current = transformer.apply(current);
            } catch (RuntimeException e) {
                throw new StateMigrationException("Migration step " + migrationKey(from, to) + " failed", e);
            }
            if (current == null) {
                throw new StateMigrationException("Migration step " + migrationKey(from, to) + " returned null", null);
            }
        }
        return current;
    }

    private UnaryOperator<T> transformer(String from, String to) {
        lock.readLock().lock();
        try {
            UnaryOperator<T> transformer = edges.getOrDefault(from, Map.of()).get(to);
            if (transformer == null) {
                // 경로 조회 후 다른 스레드가 등록을 덮어쓴 경우는 없음 (제거 API 없음)
                throw new NoMigrationPathException(from, to);
            }
            return transformer;
        } finally {
            lock.readLock().unlock();
        }
    }

    private static List<String> buildPath(Map<String, String> previous, String toVersion) {
        List<String> path = new ArrayList<>();
        for (String at = toVersion; at != null; at = previous.get(at)) {
            path.add(at);
        }
        Collections.reverse(path);
        return path;
    }

    private static void requireVersion(String version, String name) {
        if (version == null || version.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
