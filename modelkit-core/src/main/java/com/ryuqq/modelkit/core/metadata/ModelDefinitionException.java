package com.ryuqq.modelkit.core.metadata;

/**
 * 모델 정의 오류.
 *
 * <p>해석할 수 없는 연관관계 대상, 등록되지 않은 모델 클래스 등
 * 모델 설정 자체가 잘못된 경우 발생합니다.</p>
 *
 * <p>검증 오류({@link com.ryuqq.modelkit.core.validation.ModelValidationException})와 달리
 * 오류 리포트에 모이지 않고 즉시 전파됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class ModelDefinitionException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     */
    public ModelDefinitionException(String message) {
        super(message);
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param cause 원인
     */
    public ModelDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
