package com.ryuqq.modelkit.core.serialization;

import com.ryuqq.modelkit.core.metadata.AssociationDescriptor;
import com.ryuqq.modelkit.core.metadata.AttributeDescriptor;
import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.spi.ModelMetadata;
import com.ryuqq.modelkit.core.spi.PlainObjectConverter;
import com.ryuqq.modelkit.core.support.Futures;
import com.ryuqq.modelkit.core.support.PlainObjects;
import com.ryuqq.modelkit.core.type.DateAttributeType;
import com.ryuqq.modelkit.core.validation.ModelValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 모델 역직렬화 엔진.
 *
 * <p>타입이 없는 plain object로부터 모델 인스턴스를 만듭니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>입력을 plain object로 정규화 (호출자 데이터는 변경하지 않음, 스칼라 입력은 빈 객체로 취급)</li>
 *   <li>속성 키만 남겨 기본값 없이(applyDefaults=false) 인스턴스 생성</li>
 *   <li>날짜 타입 속성의 문자열 값을 Instant로 변환</li>
 *   <li>associations=true이면 원본 데이터에 값이 있는 연관관계마다:
 *     <ul>
 *       <li>대상 타입 해석 (실패 시 ModelDefinitionException, depth와 무관)</li>
 *       <li>depth &gt;= 0: to-many는 시퀀스가 아니면 빈 리스트, 시퀀스면 원소별 동시 역직렬화 (순서 유지);
 *           to-one은 depth-1로 역직렬화</li>
 *       <li>depth &lt; 0: 키를 설정하지 않음</li>
 *     </ul>
 *   </li>
 *   <li>validate=true이면 기본 옵션으로 검증, 실패는 그대로 전파</li>
 * </ol>
 *
 * <p>중첩 연관관계의 검증 실패도 바깥 호출의 실패가 되며, 부분 인스턴스는 반환되지 않습니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelDeserializer {

    private static final Logger log = LoggerFactory.getLogger(ModelDeserializer.class);

    private final ModelMetadata metadata;
    private final PlainObjectConverter converter;
    private final ModelValidator validator;
    private final Executor executor;

    /**
     * 생성자.
     *
     * @param metadata 메타데이터 조회
     * @param converter 입력 정규화
     * @param validator 검증 엔진
     * @param executor 연관관계 역직렬화 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ModelDeserializer(
        ModelMetadata metadata,
        PlainObjectConverter converter,
        ModelValidator validator,
        Executor executor
    ) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        if (validator == null) {
            throw new IllegalArgumentException("validator cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.metadata = metadata;
        this.converter = converter;
        this.validator = validator;
        this.executor = executor;
    }

    public <T extends Model> CompletableFuture<T> deserialize(ModelType<T> type, Object data) {
        return deserialize(type, data, DeserializeOptions.defaults());
    }

    /**
     * plain object를 모델 인스턴스로 역직렬화.
     *
     * @param type 대상 모델 타입
     * @param data 원본 데이터 (Map, Model 또는 변환기가 지원하는 객체)
     * @param options 역직렬화 옵션
     * @param <T> 모델 타입
     * @return 인스턴스 future (검증 실패 시 ModelValidationException, 정의 오류 시 ModelDefinitionException)
     * @throws IllegalArgumentException type 또는 options가 null인 경우
     */
    public <T extends Model> CompletableFuture<T> deserialize(ModelType<T> type, Object data, DeserializeOptions options) {
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        try {
            return doDeserialize(type, data, options);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private <T extends Model> CompletableFuture<T> doDeserialize(ModelType<T> type, Object data, DeserializeOptions options) {
        Map<String, Object> source = normalize(type, data);
        Class<T> modelClass = type.modelClass();
        Map<String, AttributeDescriptor> attributes = metadata.getAttributes(modelClass);

        T instance = type.create(PlainObjects.pick(source, attributes.keySet()), ConstructOptions.withoutDefaults());
        coerceDates(instance, attributes);

        CompletableFuture<Void> associations = options.associations()
            ? deserializeAssociations(instance, source, options)
            : CompletableFuture.completedFuture(null);

        return associations.thenCompose(ignored -> {
            if (!options.validate()) {
                return CompletableFuture.completedFuture(instance);
            }
            return validator.validate(instance).thenApply(valid -> instance);
        });
    }

    private Map<String, Object> normalize(ModelType<?> type, Object data) {
        if (PlainObjects.isScalar(data)) {
            log.warn("Scalar {} given for {}, deserializing as an empty object",
                PlainObjects.describe(data), type.name());
            return new LinkedHashMap<>();
        }
        return converter.toPlainObject(data);
    }

    private void coerceDates(Model instance, Map<String, AttributeDescriptor> attributes) {
        for (Map.Entry<String, AttributeDescriptor> entry : attributes.entrySet()) {
            if (!(entry.getValue().type() instanceof DateAttributeType)) {
                continue;
            }
            String key = entry.getKey();
            Object value = instance.get(key);
            if (!(value instanceof CharSequence)) {
                continue;
            }
            DateAttributeType dateType = (DateAttributeType) entry.getValue().type();
            try {
                instance.set(key, dateType.parse(value.toString()));
            } catch (DateTimeParseException e) {
                log.warn("Could not parse '{}' of {} as a date: {}",
                    key, instance.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private CompletableFuture<Void> deserializeAssociations(
        Model instance,
        Map<String, Object> source,
        DeserializeOptions options
    ) {
        Class<? extends Model> modelClass = instance.getClass();
        DeserializeOptions childOptions = options.descend();
        Map<String, CompletableFuture<?>> pending = new LinkedHashMap<>();

        for (Map.Entry<String, AssociationDescriptor> entry : metadata.getAssociations(modelClass).entrySet()) {
            String key = entry.getKey();
            Object value = source.get(key);
            if (value == null) {
                continue;
            }

            AssociationDescriptor association = entry.getValue();
            ModelType<?> target = association.target().resolve();

            if (options.depth() < 0) {
                continue;
            }

            if (association.isToMany()) {
                if (!PlainObjects.isSequence(value)) {
                    log.warn("Association '{}' of {} is not a sequence ({}), deserializing as empty list",
                        key, modelClass.getSimpleName(), PlainObjects.describe(value));
                    pending.put(key, CompletableFuture.completedFuture(new ArrayList<>()));
                    continue;
                }
                List<CompletableFuture<Model>> elements = new ArrayList<>();
                for (Object element : PlainObjects.toList(value)) {
                    elements.add(deserializeElement(target, element, childOptions));
                }
                pending.put(key, Futures.allAsList(elements));
            } else {
                pending.put(key, deserializeElement(target, value, childOptions));
            }
        }

        if (!pending.isEmpty()) {
            log.debug("Deserializing associations {} of {} (depth {})",
                pending.keySet(), modelClass.getSimpleName(), options.depth());
        }
        Map<String, Object> results = new LinkedHashMap<>();
        return Futures.allInto(pending, results).thenRun(() -> results.forEach(instance::set));
    }

    private CompletableFuture<Model> deserializeElement(ModelType<?> target, Object element, DeserializeOptions options) {
        if (element == null) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.fork(executor, () -> deserialize(target, element, options).thenApply(Model.class::cast));
    }
}
