package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.type.AttributeType;

/**
 * 모델 속성 정의.
 *
 * <p><strong>불변식:</strong> optional이 false이고 기본값이 없으면,
 * 생성 이후 null이 아닌 값을 가져야 검증을 통과합니다.</p>
 *
 * @param type 속성 타입
 * @param defaultValue 기본값 (null 가능)
 * @param optional 선택 속성 여부
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record AttributeDescriptor(
    AttributeType type,
    DefaultValue defaultValue,
    boolean optional
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException type이 null인 경우
     */
    public AttributeDescriptor {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
    }

    /**
     * 기본값이 정의되어 있는지 확인.
     *
     * @return 기본값이 있으면 true
     */
    public boolean hasDefault() {
        return defaultValue != null;
    }

    /**
     * 기본값의 구체 값 (지연 기본값은 호출하여 계산).
     *
     * @return 기본값, 없으면 null
     */
    public Object resolveDefault() {
        return defaultValue == null ? null : defaultValue.resolve();
    }
}
