package com.ryuqq.unifiedstate.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@code Map<String, Object>} 문서 값 유틸리티 (TOOL, GLOBAL 도메인).
 *
 * <p>{@link #copyOf(Map)}는 중첩된 Map과 Collection까지 복사한 불변 문서를 반환합니다.
 * 키 순서는 유지되며, 호출자가 원본을 이후에 변경해도 복사본에는 영향이 없습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Documents {

    /**
     * 문서 값 타입 ({@code StateProvider.valueType()} 등에서 사용).
     */
    @SuppressWarnings("unchecked")
    public static final Class<Map<String, Object>> TYPE = (Class<Map<String, Object>>) (Class<?>) Map.class;

    private Documents() {
    }

    /**
     * 불변 깊은 복사본 생성.
     *
     * @param document 원본 문서
     * @return 불변 복사본
     * @throws IllegalArgumentException document가 null이거나 문자열이 아닌 키가 있는 경우
     */
    public static Map<String, Object> copyOf(Map<?, ?> document) {
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : document.entrySet()) {
            if (!(entry.getKey() instanceof String key)) {
                throw new IllegalArgumentException("document keys must be strings, found: " + entry.getKey());
            }
            copy.put(key, copyValue(entry.getValue()));
        }
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> nested) {
            return copyOf(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(copyValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
