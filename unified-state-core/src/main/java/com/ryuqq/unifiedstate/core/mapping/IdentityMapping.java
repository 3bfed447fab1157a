package com.ryuqq.unifiedstate.core.mapping;

import com.ryuqq.unifiedstate.core.spi.StateMapping;

/**
 * 값을 그대로 전달하는 매핑 (양방향 지원).
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class IdentityMapping implements StateMapping {

    private static final IdentityMapping INSTANCE = new IdentityMapping();

    private IdentityMapping() {
    }

    /**
     * 싱글톤 인스턴스 조회.
     *
     * @return IdentityMapping
     */
    public static IdentityMapping instance() {
        return INSTANCE;
    }

    @Override
    public Object mapState(Object source) {
        return source;
    }

    @Override
    public boolean supportsReverse() {
        return true;
    }

    @Override
    public Object reverseMap(Object target) {
        return target;
    }

    @Override
    public String toString() {
        return "IdentityMapping";
    }
}
