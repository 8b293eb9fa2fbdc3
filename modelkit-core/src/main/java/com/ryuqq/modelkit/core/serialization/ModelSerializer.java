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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 모델 직렬화 엔진.
 *
 * <p>인스턴스를 plain object로 투영합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <ol>
 *   <li>등록된 속성 키만 남김 (그 외 필드는 모두 버림)</li>
 *   <li>associations=true이고 depth &gt;= 0이면 값이 있는 연관관계마다:
 *     <ul>
 *       <li>대상 타입 해석 (실패 시 ModelDefinitionException)</li>
 *       <li>to-many: 시퀀스가 아니면 빈 리스트, 시퀀스면 각 원소를 depth-1로 동시에 직렬화 (순서 유지)</li>
 *       <li>to-one: 값을 depth-1로 직렬화</li>
 *     </ul>
 *   </li>
 *   <li>depth &lt; 0이면 속성만 출력 (재귀 깊이 제한)</li>
 * </ol>
 *
 * <p>순환 참조 그래프(author → books → author)도 depth로 종료가 보장됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelSerializer {

    private static final Logger log = LoggerFactory.getLogger(ModelSerializer.class);

    private final ModelMetadata metadata;
    private final PlainObjectConverter converter;
    private final Executor executor;

    /**
     * 생성자.
     *
     * @param metadata 메타데이터 조회
     * @param converter 모델이 아닌 연관관계 값 변환기
     * @param executor 연관관계 직렬화 실행자
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ModelSerializer(ModelMetadata metadata, PlainObjectConverter converter, Executor executor) {
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        if (converter == null) {
            throw new IllegalArgumentException("converter cannot be null");
        }
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        this.metadata = metadata;
        this.converter = converter;
        this.executor = executor;
    }

    public CompletableFuture<Map<String, Object>> serialize(Model instance) {
        return serialize(instance, SerializeOptions.defaults());
    }

    /**
     * 인스턴스 직렬화.
     *
     * @param instance 직렬화할 인스턴스
     * @param options 직렬화 옵션
     * @return plain object future (정의 오류 시 ModelDefinitionException으로 완료)
     * @throws IllegalArgumentException instance 또는 options가 null인 경우
     */
    public CompletableFuture<Map<String, Object>> serialize(Model instance, SerializeOptions options) {
        if (instance == null) {
            throw new IllegalArgumentException("instance cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        try {
            return doSerialize(instance, options);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private CompletableFuture<Map<String, Object>> doSerialize(Model instance, SerializeOptions options) {
        Class<? extends Model> modelClass = instance.getClass();
        Map<String, AttributeDescriptor> attributes = metadata.getAttributes(modelClass);
        Map<String, Object> output = PlainObjects.pick(instance.fields(), attributes.keySet());

        if (!options.associations() || options.depth() < 0) {
            return CompletableFuture.completedFuture(output);
        }

        log.debug("Serializing associations of {} (depth {})", modelClass.getSimpleName(), options.depth());
        SerializeOptions childOptions = options.descend();
        Map<String, CompletableFuture<?>> pending = new LinkedHashMap<>();

        for (Map.Entry<String, AssociationDescriptor> entry : metadata.getAssociations(modelClass).entrySet()) {
            String key = entry.getKey();
            AssociationDescriptor association = entry.getValue();
            Object value = instance.get(key);
            if (value == null) {
                continue;
            }

            ModelType<?> target = association.target().resolve();

            if (association.isToMany()) {
                if (!PlainObjects.isSequence(value)) {
                    log.warn("Association '{}' of {} is not a sequence ({}), serializing as empty list",
                        key, modelClass.getSimpleName(), PlainObjects.describe(value));
                    pending.put(key, CompletableFuture.completedFuture(new ArrayList<>()));
                    continue;
                }
                List<CompletableFuture<Map<String, Object>>> elements = new ArrayList<>();
                for (Object element : PlainObjects.toList(value)) {
                    elements.add(serializeElement(element, target, childOptions));
                }
                pending.put(key, Futures.allAsList(elements));
            } else {
                pending.put(key, serializeElement(value, target, childOptions));
            }
        }

        return Futures.allInto(pending, output).thenApply(ignored -> output);
    }

    private CompletableFuture<Map<String, Object>> serializeElement(
        Object element,
        ModelType<?> target,
        SerializeOptions options
    ) {
        if (element == null) {
            return CompletableFuture.completedFuture(null);
        }
        return Futures.fork(executor, () -> serialize(asModel(element, target), options));
    }

    /**
     * 연관관계 원소가 모델 인스턴스가 아니면 대상 타입 인스턴스로 만듦 (기본값 미적용, 스칼라는 빈 인스턴스).
     */
    private Model asModel(Object element, ModelType<?> target) {
        if (element instanceof Model) {
            return (Model) element;
        }
        Map<String, Object> data = PlainObjects.isScalar(element)
            ? new LinkedHashMap<>()
            : converter.toPlainObject(element);
        return target.create(data, ConstructOptions.withoutDefaults());
    }
}
