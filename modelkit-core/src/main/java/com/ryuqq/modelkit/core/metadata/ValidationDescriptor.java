package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.validation.ValidationRule;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 속성에 등록된 사용자 정의 검증 규칙과 그 옵션.
 *
 * @param rule 검증 규칙
 * @param options 규칙 옵션 (불변, null 값 허용)
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record ValidationDescriptor(
    ValidationRule rule,
    Map<String, Object> options
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException rule이 null인 경우
     */
    public ValidationDescriptor {
        if (rule == null) {
            throw new IllegalArgumentException("rule cannot be null");
        }
        options = options == null
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new LinkedHashMap<>(options));
    }
}
