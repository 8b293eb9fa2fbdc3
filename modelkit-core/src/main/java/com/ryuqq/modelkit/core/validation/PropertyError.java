package com.ryuqq.modelkit.core.validation;

/**
 * 속성 하나의 검증 오류 항목.
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>PropertyError.of("attribute.required", "Value is required")</li>
 *   <li>PropertyError.of("attribute.type", "Value of 'age' must be of type integer")</li>
 * </ul>
 *
 * @param kind 오류 종류 (예: attribute.required, unknown)
 * @param message 오류 메시지
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record PropertyError(
    String kind,
    String message
) {

    /**
     * 필수 값 누락 오류 종류.
     */
    public static final String REQUIRED = "attribute.required";

    /**
     * 분류되지 않은 오류 종류.
     */
    public static final String UNKNOWN = "unknown";

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 message가 null이거나 빈 문자열인 경우
     */
    public PropertyError {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
    }

    public static PropertyError of(String kind, String message) {
        return new PropertyError(kind, message);
    }

    /**
     * 필수 값 누락 오류.
     *
     * @return attribute.required 오류
     */
    public static PropertyError required() {
        return new PropertyError(REQUIRED, "Value is required");
    }
}
