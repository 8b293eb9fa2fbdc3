package com.ryuqq.modelkit.core.validation;

import com.ryuqq.modelkit.core.model.Model;

/**
 * 모델 인스턴스 검증 실패.
 *
 * <p>모든 속성을 검사한 뒤 한 번만 발생하며, 전체 오류 리포트를 담습니다.
 * 역직렬화에서도 그대로 전파됩니다.</p>
 *
 * <pre>
 * try {
 *     user.validate().join();
 * } catch (CompletionException e) {
 *     ModelValidationException failure = (ModelValidationException) e.getCause();
 *     failure.getErrors().get("email");
 * }
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class ModelValidationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final transient Class<? extends Model> modelType;
    private final transient ModelErrors errors;

    /**
     * 생성자.
     *
     * @param modelType 검증 대상 모델 타입
     * @param message 오류 메시지
     * @param errors 오류 리포트
     * @throws IllegalArgumentException modelType 또는 errors가 null인 경우
     */
    public ModelValidationException(Class<? extends Model> modelType, String message, ModelErrors errors) {
        super(message);
        if (modelType == null) {
            throw new IllegalArgumentException("modelType cannot be null");
        }
        if (errors == null) {
            throw new IllegalArgumentException("errors cannot be null");
        }
        this.modelType = modelType;
        this.errors = errors;
    }

    public Class<? extends Model> getModelType() {
        return modelType;
    }

    public ModelErrors getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{" + modelType.getSimpleName() + ": " + getMessage() + ", " + errors + '}';
    }
}
