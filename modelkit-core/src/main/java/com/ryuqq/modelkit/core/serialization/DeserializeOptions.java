package com.ryuqq.modelkit.core.serialization;

/**
 * 역직렬화 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>validate: 생성된 인스턴스 검증 여부 (기본 true)</li>
 *   <li>associations: 연관관계 복원 여부 (기본 true)</li>
 *   <li>depth: 연관관계 복원 깊이 (기본 1)</li>
 * </ul>
 *
 * @param validate 검증 여부
 * @param associations 연관관계 복원 여부
 * @param depth 복원 깊이
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record DeserializeOptions(boolean validate, boolean associations, int depth) {

    private static final DeserializeOptions DEFAULTS =
        new DeserializeOptions(true, true, SerializeOptions.DEFAULT_DEPTH);

    public static DeserializeOptions defaults() {
        return DEFAULTS;
    }

    public DeserializeOptions withValidate(boolean validate) {
        return new DeserializeOptions(validate, this.associations, this.depth);
    }

    public DeserializeOptions withAssociations(boolean associations) {
        return new DeserializeOptions(this.validate, associations, this.depth);
    }

    public DeserializeOptions withDepth(int depth) {
        return new DeserializeOptions(this.validate, this.associations, depth);
    }

    /**
     * 한 단계 아래 연관관계용 옵션.
     *
     * @return depth가 1 감소한 새 옵션
     */
    public DeserializeOptions descend() {
        return withDepth(depth - 1);
    }
}
