package com.ryuqq.unifiedstate.core.mapping;

import com.ryuqq.unifiedstate.core.spi.StateMapping;

import java.util.function.Function;

/**
 * 함수 기반 매핑.
 *
 * <p>forward 함수는 필수이며, reverse 함수가 주어진 경우에만 역방향을 지원합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StateMapping workflowToSession = FunctionMapping.of(
 *     source -&gt; Map.of("stage", ((WorkflowState) source).currentStage())
 * );
 * </pre>
 *
 * @param <S> 소스 값 타입
 * @param <T> 타겟 값 타입
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class FunctionMapping<S, T> implements StateMapping {

    private final Class<S> sourceType;
    private final Class<T> targetType;
    private final Function<S, T> forward;
    private final Function<T, S> reverse;

    private FunctionMapping(Class<S> sourceType, Class<T> targetType, Function<S, T> forward, Function<T, S> reverse) {
        if (sourceType == null) {
            throw new IllegalArgumentException("sourceType cannot be null");
        }
        if (targetType == null) {
            throw new IllegalArgumentException("targetType cannot be null");
        }
        if (forward == null) {
            throw new IllegalArgumentException("forward cannot be null");
        }
        this.sourceType = sourceType;
        this.targetType = targetType;
        this.forward = forward;
        this.reverse = reverse;
    }

    /**
     * 단방향 매핑 생성.
     *
     * @param sourceType 소스 값 클래스
     * @param targetType 타겟 값 클래스
     * @param forward 정방향 함수
     * @return FunctionMapping 인스턴스
     */
    public static <S, T> FunctionMapping<S, T> of(Class<S> sourceType, Class<T> targetType, Function<S, T> forward) {
        return new FunctionMapping<>(sourceType, targetType, forward, null);
    }

    /**
     * 양방향 매핑 생성.
     *
     * @param sourceType 소스 값 클래스
     * @param targetType 타겟 값 클래스
     * @param forward 정방향 함수
     * @param reverse 역방향 함수
     * @return FunctionMapping 인스턴스
     * @throws IllegalArgumentException reverse가 null인 경우
     */
    public static <S, T> FunctionMapping<S, T> reversible(
        Class<S> sourceType, Class<T> targetType, Function<S, T> forward, Function<T, S> reverse
    ) {
        if (reverse == null) {
            throw new IllegalArgumentException("reverse cannot be null");
        }
        return new FunctionMapping<>(sourceType, targetType, forward, reverse);
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalArgumentException source가 sourceType 인스턴스가 아닌 경우
     */
    @Override
    public Object mapState(Object source) {
        if (!sourceType.isInstance(source)) {
            throw new IllegalArgumentException(String.format(
                "Expected source of type %s but was %s", sourceType.getName(), describe(source)));
        }
        return forward.apply(sourceType.cast(source));
    }

    @Override
    public boolean supportsReverse() {
        return reverse != null;
    }

    @Override
    public Object reverseMap(Object target) {
        if (reverse == null) {
            throw new UnsupportedOperationException("Reverse mapping not supported");
        }
        if (!targetType.isInstance(target)) {
            throw new IllegalArgumentException(String.format(
                "Expected target of type %s but was %s", targetType.getName(), describe(target)));
        }
        return reverse.apply(targetType.cast(target));
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }
}
