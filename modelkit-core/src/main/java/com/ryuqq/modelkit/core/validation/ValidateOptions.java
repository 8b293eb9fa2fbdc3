package com.ryuqq.modelkit.core.validation;

/**
 * 검증 옵션.
 *
 * @param required 필수 속성 누락을 오류로 기록할지 여부 (기본 true)
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record ValidateOptions(boolean required) {

    private static final ValidateOptions DEFAULTS = new ValidateOptions(true);

    public static ValidateOptions defaults() {
        return DEFAULTS;
    }

    /**
     * required만 변경한 새 인스턴스 생성.
     *
     * @param required 새 값
     * @return 새 ValidateOptions
     */
    public ValidateOptions withRequired(boolean required) {
        return new ValidateOptions(required);
    }
}
