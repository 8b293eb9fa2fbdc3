package com.ryuqq.modelkit.core.type;

/**
 * 값 검증 기능을 제공하는 속성 타입.
 *
 * <p>검증 실패 시 예외를 던집니다. {@link com.ryuqq.modelkit.core.validation.PropertyValidationException}이
 * 아닌 예외는 검증 엔진에서 {@code unknown} 종류로 변환됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public interface ValidatingAttributeType extends AttributeType {

    /**
     * 값 검증.
     *
     * @param key 속성 이름
     * @param value 검증할 값 (null 가능)
     * @throws com.ryuqq.modelkit.core.validation.PropertyValidationException 값이 타입과 맞지 않는 경우
     */
    void validate(String key, Object value);
}
