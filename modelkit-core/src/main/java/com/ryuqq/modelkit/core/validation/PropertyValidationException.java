package com.ryuqq.modelkit.core.validation;

/**
 * 속성 단위 검증 실패.
 *
 * <p>타입 검증과 사용자 정의 검증 규칙이 던지는 예외입니다.
 * 다른 종류의 예외는 검증 엔진이 {@link #coerce(Throwable)}로 종류 {@code unknown}의
 * 이 예외로 변환합니다 (메시지는 유지, 원래 타입 정보는 사라짐).</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class PropertyValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String kind;

    /**
     * 생성자.
     *
     * @param kind 오류 종류
     * @param message 오류 메시지
     * @throws IllegalArgumentException kind가 null이거나 빈 문자열인 경우
     */
    public PropertyValidationException(String kind, String message) {
        super(message);
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        this.kind = kind;
    }

    public String getKind() {
        return kind;
    }

    /**
     * 임의의 예외를 속성 검증 예외로 변환.
     *
     * @param error 원래 예외
     * @return 이미 PropertyValidationException이면 그대로, 아니면 종류 unknown으로 변환된 예외
     */
    public static PropertyValidationException coerce(Throwable error) {
        if (error instanceof PropertyValidationException) {
            return (PropertyValidationException) error;
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return new PropertyValidationException(PropertyError.UNKNOWN, message);
    }

    /**
     * 오류 리포트 항목으로 변환.
     *
     * @return PropertyError
     */
    public PropertyError toError() {
        return PropertyError.of(kind, getMessage() == null ? "" : getMessage());
    }
}
