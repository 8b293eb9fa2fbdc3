package com.ryuqq.modelkit.core.type;

import com.ryuqq.modelkit.core.validation.PropertyValidationException;

import java.util.function.Predicate;

/**
 * 술어(Predicate) 하나로 값을 판별하는 속성 타입.
 *
 * <p>null 값은 항상 통과합니다 (필수 여부는 검증 엔진이 판단).</p>
 *
 * <pre>
 * AttributeType uuid = new ScalarType("uuid", v -&gt; v instanceof UUID);
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class ScalarType implements ValidatingAttributeType {

    private final String name;
    private final Predicate<Object> accepts;

    /**
     * 생성자.
     *
     * @param name 타입 이름
     * @param accepts 허용 여부 판별 함수
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ScalarType(String name, Predicate<Object> accepts) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (accepts == null) {
            throw new IllegalArgumentException("accepts cannot be null");
        }
        this.name = name;
        this.accepts = accepts;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public void validate(String key, Object value) {
        if (value != null && !accepts.test(value)) {
            throw new PropertyValidationException(
                Types.TYPE_ERROR,
                String.format("Value of '%s' must be of type %s", key, name)
            );
        }
    }

    @Override
    public String toString() {
        return "AttributeType{" + name + '}';
    }
}
