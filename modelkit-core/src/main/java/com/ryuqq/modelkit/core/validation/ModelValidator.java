package com.ryuqq.modelkit.core.validation;

import com.ryuqq.modelkit.core.metadata.AttributeDescriptor;
import com.ryuqq.modelkit.core.metadata.ValidationDescriptor;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.spi.ModelMetadata;
import com.ryuqq.modelkit.core.type.ValidatingAttributeType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 모델 검증 엔진.
 *
 * <p>인스턴스의 모든 속성을 검사하여 오류 리포트를 만들고,
 * 오류가 하나라도 있으면 {@link ModelValidationException}으로 실패합니다.</p>
 *
 * <p><strong>속성별 처리 순서:</strong></p>
 * <ol>
 *   <li>현재 값 조회</li>
 *   <li>값이 null인 경우:
 *     <ul>
 *       <li>선택 속성 → 이 속성의 나머지 검사 생략</li>
 *       <li>required=true → attribute.required 기록 후 계속</li>
 *       <li>required=false → 기록 없이 계속</li>
 *     </ul>
 *   </li>
 *   <li>값이 null이고 기본값이 있으면 기본값의 구체 값으로 대체하여 검사</li>
 *   <li>타입 검증 ({@link ValidatingAttributeType}인 경우)</li>
 *   <li>사용자 정의 규칙 (각각 독립 실행)</li>
 *   <li>오류가 있으면 리포트에 누적</li>
 * </ol>
 *
 * <p>한 번의 호출에서 모든 속성과 모든 규칙이 실행됩니다 (fail-fast 아님).</p>
 *
 * <p>규칙이나 타입이 던진 예외와 {@link AssertionError}는 리포트 항목으로 변환됩니다.
 * 그 밖의 {@link Error}(OutOfMemoryError 등)는 변환하지 않고 그대로 전파합니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelValidator {

    private static final Logger log = LoggerFactory.getLogger(ModelValidator.class);

    static final String FAILURE_MESSAGE = "Validation error";

    private final ModelMetadata metadata;
    private final Executor executor;

    /**
     * 생성자.
     *
     * @param metadata 메타데이터 조회
     * @param executor 검증 작업 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ModelValidator(ModelMetadata metadata, Executor executor) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.metadata = metadata;
        this.executor = executor;
    }

    public CompletableFuture<Void> validate(Model instance) {
        return validate(instance, ValidateOptions.defaults());
    }

    /**
     * 인스턴스 검증.
     *
     * @param instance 검증할 인스턴스
     * @param options 검증 옵션
     * @return 성공 시 정상 완료, 실패 시 ModelValidationException으로 완료되는 future
     * @throws IllegalArgumentException instance 또는 options가 null인 경우
     */
    public CompletableFuture<Void> validate(Model instance, ValidateOptions options) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        return CompletableFuture.runAsync(() -> {
            ModelErrors errors = collectErrors(instance, options);
            if (!errors.isEmpty()) {
                log.debug("Validation of {} failed for attributes {}",
                    instance.getClass().getSimpleName(), errors.attributes());
                throw new ModelValidationException(instance.getClass(), FAILURE_MESSAGE, errors);
            }
        }, executor);
    }

    /**
     * 예외 없이 오류 리포트만 생성.
     *
     * @param instance 검증할 인스턴스
     * @param options 검증 옵션
     * @return 오류 리포트 (비어 있으면 유효)
     */
    public ModelErrors collectErrors(Model instance, ValidateOptions options) {
        Class<? extends Model> modelClass = instance.getClass();
        Map<String, AttributeDescriptor> attributes = metadata.getAttributes(modelClass);
        ModelErrors errors = new ModelErrors();

        for (Map.Entry<String, AttributeDescriptor> entry : attributes.entrySet()) {
            String key = entry.getKey();
            AttributeDescriptor attribute = entry.getValue();
            Object value = instance.get(key);
            List<PropertyError> attributeErrors = new ArrayList<>();

            if (value == null) {
                if (attribute.optional()) {
                    continue;
                }
                if (options.required()) {
                    attributeErrors.add(PropertyError.required());
                }
            }

            Object checked = value == null && attribute.hasDefault() ? attribute.resolveDefault() : value;

            if (attribute.type() instanceof ValidatingAttributeType) {
                ValidatingAttributeType type = (ValidatingAttributeType) attribute.type();
                try {
                    type.validate(key, checked);
                } catch (Exception | AssertionError e) {
                    attributeErrors.add(PropertyValidationException.coerce(e).toError());
                }
            }

            // 규칙마다 개별 try/catch: 모든 규칙이 실행되어야 함
            for (ValidationDescriptor validation : metadata.getAttributeValidations(modelClass, key)) {
                try {
                    validation.rule().validate(key, checked, validation.options());
                } catch (Exception | AssertionError e) {
                    attributeErrors.add(PropertyValidationException.coerce(e).toError());
                }
            }

            errors.append(key, attributeErrors);
        }
        return errors;
    }
}
