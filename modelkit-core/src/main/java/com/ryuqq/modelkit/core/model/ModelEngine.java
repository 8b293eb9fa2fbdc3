package com.ryuqq.modelkit.core.model;

import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.metadata.RegisteredModelMetadata;
import com.ryuqq.modelkit.core.serialization.DefaultPlainObjectConverter;
import com.ryuqq.modelkit.core.serialization.DeserializeOptions;
import com.ryuqq.modelkit.core.serialization.ModelDeserializer;
import com.ryuqq.modelkit.core.serialization.ModelSerializer;
import com.ryuqq.modelkit.core.serialization.SerializeOptions;
import com.ryuqq.modelkit.core.spi.ModelMetadata;
import com.ryuqq.modelkit.core.spi.PlainObjectConverter;
import com.ryuqq.modelkit.core.validation.ModelValidator;
import com.ryuqq.modelkit.core.validation.ValidateOptions;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * 검증/직렬화/역직렬화 엔진 묶음.
 *
 * <p>{@link Model}의 인스턴스 메서드와 {@link ModelType#deserialize(Object)}는
 * {@link #defaults()} 엔진에 위임합니다. 다른 메타데이터, 입력 변환기, 실행자가 필요하면
 * {@link #builder()}로 별도 엔진을 만듭니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>기본 실행자는 호출 스레드에서 바로 실행 (단일 스레드 협력 모델)</li>
 *   <li>형제 연관관계 작업은 함께 시작되어 함께 기다림</li>
 *   <li>각 결과는 자신의 키에만 기록되므로 잠금이 필요 없음</li>
 *   <li>호출 중인 인스턴스 그래프를 다른 곳에서 변경하지 않는 것은 호출자 책임</li>
 * </ul>
 *
 * <pre>
 * ModelEngine engine = ModelEngine.builder()
 *     .executor(ForkJoinPool.commonPool())
 *     .build();
 *
 * Map&lt;String, Object&gt; json = engine.serialize(user, SerializeOptions.defaults().withDepth(2)).join();
 * User copy = engine.deserialize(User.TYPE, json).join();
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelEngine {

    /**
     * 호출 스레드에서 즉시 실행하는 실행자.
     */
    public static final Executor DIRECT_EXECUTOR = Runnable::run;

    private static final ModelEngine DEFAULT = builder().build();

    private final ModelMetadata metadata;
    private final PlainObjectConverter converter;
    private final ModelValidator validator;
    private final ModelSerializer serializer;
    private final ModelDeserializer deserializer;

    private ModelEngine(Builder builder) {
        this.metadata = builder.metadata;
        this.converter = builder.converter;
        this.validator = new ModelValidator(metadata, builder.executor);
        this.serializer = new ModelSerializer(metadata, converter, builder.executor);
        this.deserializer = new ModelDeserializer(metadata, converter, validator, builder.executor);
    }

    /**
     * 기본 엔진 (레지스트리 메타데이터, 기본 변환기, 직접 실행자).
     *
     * @return 공유 엔진
     */
    public static ModelEngine defaults() {
        return DEFAULT;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ModelMetadata metadata() {
        return metadata;
    }

    public PlainObjectConverter converter() {
        return converter;
    }

    public ModelValidator validator() {
        return validator;
    }

    public ModelSerializer serializer() {
        return serializer;
    }

    public ModelDeserializer deserializer() {
        return deserializer;
    }

    public CompletableFuture<Void> validate(Model instance) {
        return validator.validate(instance);
    }

    public CompletableFuture<Void> validate(Model instance, ValidateOptions options) {
        return validator.validate(instance, options);
    }

    public CompletableFuture<Map<String, Object>> serialize(Model instance) {
        return serializer.serialize(instance);
    }

    public CompletableFuture<Map<String, Object>> serialize(Model instance, SerializeOptions options) {
        return serializer.serialize(instance, options);
    }

    public <T extends Model> CompletableFuture<T> deserialize(ModelType<T> type, Object data) {
        return deserializer.deserialize(type, data);
    }

    public <T extends Model> CompletableFuture<T> deserialize(ModelType<T> type, Object data, DeserializeOptions options) {
        return deserializer.deserialize(type, data, options);
    }

    /**
     * ModelEngine 빌더.
     */
    public static final class Builder {

        private ModelMetadata metadata = RegisteredModelMetadata.getInstance();
        private PlainObjectConverter converter = new DefaultPlainObjectConverter();
        private Executor executor = DIRECT_EXECUTOR;

        private Builder() {
        }

        public Builder metadata(ModelMetadata metadata) {
            if (metadata == null) {
                throw new IllegalArgumentException("metadata cannot be null");
            }
            this.metadata = metadata;
            return this;
        }

        public Builder converter(PlainObjectConverter converter) {
            if (converter == null) {
                throw new IllegalArgumentException("converter cannot be null");
            }
            this.converter = converter;
            return this;
        }

        /**
         * 연관관계와 검증 작업을 실행할 실행자.
         *
         * @param executor 실행자
         * @return this
         */
        public Builder executor(Executor executor) {
            if (executor == null) {
                throw new IllegalArgumentException("executor cannot be null");
            }
            this.executor = executor;
            return this;
        }

        public ModelEngine build() {
            return new ModelEngine(this);
        }
    }
}
