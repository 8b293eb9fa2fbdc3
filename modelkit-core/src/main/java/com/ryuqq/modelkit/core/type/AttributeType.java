package com.ryuqq.modelkit.core.type;

/**
 * 속성의 의미 타입.
 *
 * <p>검증 기능이 필요한 타입은 {@link ValidatingAttributeType}을,
 * 날짜 타입은 {@link DateAttributeType}을 구현합니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public interface AttributeType {

    /**
     * 타입 이름 (예: string, date).
     *
     * @return 타입 이름
     */
    String name();
}
