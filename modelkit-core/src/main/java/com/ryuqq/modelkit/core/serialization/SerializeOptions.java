package com.ryuqq.modelkit.core.serialization;

/**
 * 직렬화 옵션 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>associations: 연관관계 확장 여부 (기본 true)</li>
 *   <li>depth: 연관관계 확장 깊이 (기본 1). 단계마다 1씩 감소하며, 0 미만이면 확장하지 않음</li>
 * </ul>
 *
 * @param associations 연관관계 확장 여부
 * @param depth 확장 깊이
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record SerializeOptions(boolean associations, int depth) {

    public static final int DEFAULT_DEPTH = 1;

    private static final SerializeOptions DEFAULTS = new SerializeOptions(true, DEFAULT_DEPTH);

    /**
     * 기본 옵션 (associations=true, depth=1).
     *
     * @return 기본 옵션
     */
    public static SerializeOptions defaults() {
        return DEFAULTS;
    }

    public SerializeOptions withAssociations(boolean associations) {
        return new SerializeOptions(associations, this.depth);
    }

    public SerializeOptions withDepth(int depth) {
        return new SerializeOptions(this.associations, depth);
    }

    /**
     * 한 단계 아래 연관관계용 옵션.
     *
     * @return depth가 1 감소한 새 옵션
     */
    public SerializeOptions descend() {
        return withDepth(depth - 1);
    }
}
