package com.ryuqq.modelkit.core.model;

/**
 * 모델 생성 옵션.
 *
 * @param applyDefaults 속성 기본값을 인스턴스에 적용할지 여부 (기본 true)
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record ConstructOptions(boolean applyDefaults) {

    private static final ConstructOptions DEFAULTS = new ConstructOptions(true);
    private static final ConstructOptions WITHOUT_DEFAULTS = new ConstructOptions(false);

    public static ConstructOptions defaults() {
        return DEFAULTS;
    }

    /**
     * 기본값을 적용하지 않는 옵션 (역직렬화용).
     *
     * @return applyDefaults=false
     */
    public static ConstructOptions withoutDefaults() {
        return WITHOUT_DEFAULTS;
    }
}
