package com.ryuqq.unifiedstate.core.mapping;

import com.ryuqq.unifiedstate.core.spi.StateMapping;

import java.util.Arrays;
import java.util.List;

/**
 * 여러 매핑을 순서대로 연결한 매핑.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>mapState: 등록 순서대로 적용</li>
 *   <li>reverseMap: 역순으로 각 매핑의 reverseMap 적용</li>
 *   <li>supportsReverse: 모든 하위 매핑이 역방향을 지원할 때만 true</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CompositeMapping implements StateMapping {

    private final List<StateMapping> mappings;

    private CompositeMapping(List<StateMapping> mappings) {
        if (mappings == null || mappings.isEmpty()) {
            throw new IllegalArgumentException("mappings cannot be null or empty");
        }
        for (StateMapping mapping : mappings) {
            if (mapping == null) {
                throw new IllegalArgumentException("mappings cannot contain null");
            }
        }
        this.mappings = List.copyOf(mappings);
    }

    /**
     * CompositeMapping 생성.
     *
     * @param mappings 연결할 매핑 (적용 순서)
     * @return CompositeMapping 인스턴스
     */
    public static CompositeMapping of(StateMapping... mappings) {
        return new CompositeMapping(mappings == null ? null : Arrays.asList(mappings));
    }

    /**
     * CompositeMapping 생성.
     *
     * @param mappings 연결할 매핑 (적용 순서)
     * @return CompositeMapping 인스턴스
     */
    public static CompositeMapping of(List<StateMapping> mappings) {
        return new CompositeMapping(mappings);
    }

    @Override
    public Object mapState(Object source) {
        Object current = source;
        for (StateMapping mapping : mappings) {
            current = mapping.mapState(current);
        }
        return current;
    }

    @Override
    public boolean supportsReverse() {
        return mappings.stream().allMatch(StateMapping::supportsReverse);
    }

    @Override
    public Object reverseMap(Object target) {
        if (!supportsReverse()) {
            throw new UnsupportedOperationException("Not all mappings in the chain support reverse");
        }
        Object current = target;
        for (int i = mappings.size() - 1; i >= 0; i--) {
            current = mappings.get(i).reverseMap(current);
        }
        return current;
    }

    /**
     * 하위 매핑 목록 조회.
     *
     * @return 불변 매핑 목록
     */
    public List<StateMapping> mappings() {
        return mappings;
    }
}
