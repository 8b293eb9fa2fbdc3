package com.ryuqq.modelkit.core.validation;

import java.util.Map;

/**
 * 속성에 등록되는 사용자 정의 검증 규칙.
 *
 * <p>실패 시 예외를 던집니다. 규칙끼리는 서로 독립적으로 실행되어,
 * 한 규칙의 실패가 다른 규칙 실행을 막지 않습니다.</p>
 *
 * <pre>
 * ValidationRule notAdmin = (key, value, options) -&gt; {
 *     if ("admin".equals(value)) {
 *         throw new PropertyValidationException("attribute.reserved", "Reserved name");
 *     }
 * };
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ValidationRule {

    /**
     * 값 검증.
     *
     * @param key 속성 이름
     * @param value 검증할 값 (null 가능)
     * @param options 규칙 등록 시 지정한 옵션
     * @throws Exception 검증 실패 시
     */
    void validate(String key, Object value, Map<String, Object> options) throws Exception;
}
