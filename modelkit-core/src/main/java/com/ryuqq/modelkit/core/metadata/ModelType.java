package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.model.ModelEngine;
import com.ryuqq.modelkit.core.serialization.DeserializeOptions;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * 등록된 모델 타입 핸들.
 *
 * <p>모델 클래스, 인스턴스 팩토리, 정의 테이블({@link ModelDescriptor})을 묶습니다.
 * 각 모델 클래스는 자신의 핸들을 상수로 보관합니다:</p>
 *
 * <pre>
 * public final class User extends Model {
 *
 *     public static final ModelType&lt;User&gt; TYPE = ModelType.define(User.class, User::new, b -&gt; b
 *         .attribute("name", Types.STRING)
 *         .hasMany("posts", TargetRef.deferred(() -&gt; Post.TYPE)));
 *
 *     public User(Map&lt;String, ?&gt; data, ConstructOptions options) {
 *         super(data, options);
 *     }
 * }
 * </pre>
 *
 * <p><strong>레지스트리:</strong> 클래스당 한 번만 정의할 수 있으며,
 * 정의 이후에는 읽기 전용입니다.</p>
 *
 * @param <T> 모델 타입
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelType<T extends Model> {

    private static final Map<Class<?>, ModelType<?>> REGISTRY = new ConcurrentHashMap<>();

    private final Class<T> modelClass;
    private final ModelFactory<T> factory;
    private final ModelDescriptor descriptor;

    private ModelType(Class<T> modelClass, ModelFactory<T> factory, ModelDescriptor descriptor) {
        this.modelClass = modelClass;
        this.factory = factory;
        this.descriptor = descriptor;
    }

    /**
     * 모델 타입 정의 및 등록.
     *
     * @param modelClass 모델 클래스
     * @param factory 인스턴스 팩토리
     * @param definition 정의 빌더 콜백
     * @param <T> 모델 타입
     * @return 등록된 모델 타입
     * @throws IllegalArgumentException 인자가 null이거나 이미 정의된 클래스인 경우
     */
    public static <T extends Model> ModelType<T> define(
        Class<T> modelClass,
        ModelFactory<T> factory,
        Consumer<ModelDescriptor.Builder> definition
    ) {
        return extend(modelClass, factory, null, definition);
    }

    /**
     * 부모 모델의 정의를 상속하는 모델 타입 정의.
     *
     * @param modelClass 모델 클래스
     * @param factory 인스턴스 팩토리
     * @param parent 부모 모델 타입 (null이면 상속 없음)
     * @param definition 정의 빌더 콜백
     * @param <T> 모델 타입
     * @return 등록된 모델 타입
     */
    public static <T extends Model> ModelType<T> extend(
        Class<T> modelClass,
        ModelFactory<T> factory,
        ModelType<?> parent,
        Consumer<ModelDescriptor.Builder> definition
    ) {
        if (modelClass == null) {
            throw new IllegalArgumentException("modelClass cannot be null");
        }
        if (factory == null) {
            throw new IllegalArgumentException("factory cannot be null");
        }
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }

        ModelDescriptor.Builder builder = ModelDescriptor.builder().name(modelClass.getSimpleName());
        if (parent != null) {
            builder.inherit(parent.descriptor);
            builder.name(modelClass.getSimpleName());
        }
        definition.accept(builder);

        ModelType<T> type = new ModelType<>(modelClass, factory, builder.build());
        if (REGISTRY.putIfAbsent(modelClass, type) != null) {
            throw new IllegalArgumentException("Model type is already defined: " + modelClass.getName());
        }
        return type;
    }

    /**
     * 클래스로 모델 타입 조회.
     *
     * <p>클래스가 아직 초기화되지 않아 등록 전이라면 한 번 초기화를 강제한 뒤 다시 조회합니다.</p>
     *
     * @param modelClass 모델 클래스
     * @param <T> 모델 타입
     * @return 모델 타입
     * @throws ModelDefinitionException 정의되지 않은 클래스인 경우
     */
    @SuppressWarnings("unchecked")
    public static <T extends Model> ModelType<T> of(Class<T> modelClass) {
        if (modelClass == null) {
            throw new IllegalArgumentException("modelClass cannot be null");
        }
        ModelType<?> type = find(modelClass).orElse(null);
        if (type == null) {
            throw new ModelDefinitionException("Model type is not defined: " + modelClass.getName());
        }
        return (ModelType<T>) type;
    }

    /**
     * 클래스로 모델 타입 조회 (Optional).
     *
     * @param modelClass 모델 클래스
     * @return 모델 타입 (정의되지 않았으면 empty)
     */
    public static Optional<ModelType<?>> find(Class<?> modelClass) {
        ModelType<?> type = REGISTRY.get(modelClass);
        if (type == null && modelClass != null) {
            initialize(modelClass);
            type = REGISTRY.get(modelClass);
        }
        return Optional.ofNullable(type);
    }

    private static void initialize(Class<?> modelClass) {
        try {
            Class.forName(modelClass.getName(), true, modelClass.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new ModelDefinitionException("Model class could not be initialized: " + modelClass.getName(), e);
        }
    }

    public Class<T> modelClass() {
        return modelClass;
    }

    public ModelDescriptor descriptor() {
        return descriptor;
    }

    /**
     * 모델 이름.
     *
     * @return 정의에서 지정한 이름 (기본값: 클래스 simple name)
     */
    public String name() {
        return descriptor.name();
    }

    /**
     * 기본값이 적용된 빈 인스턴스 생성.
     *
     * @return 새 인스턴스
     */
    public T create() {
        return create(null, ConstructOptions.defaults());
    }

    public T create(Map<String, ?> data) {
        return create(data, ConstructOptions.defaults());
    }

    /**
     * 인스턴스 생성.
     *
     * @param data 초기 데이터 (null 가능)
     * @param options 생성 옵션
     * @return 새 인스턴스
     */
    @SuppressWarnings("unchecked")
    public T create(Map<String, ?> data, ConstructOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        return factory.create((Map<String, Object>) data, options);
    }

    public CompletableFuture<T> deserialize(Object data) {
        return deserialize(data, DeserializeOptions.defaults());
    }

    /**
     * plain object를 이 타입의 인스턴스로 역직렬화 ({@link ModelEngine#defaults()} 사용).
     *
     * @param data 원본 데이터
     * @param options 역직렬화 옵션
     * @return 인스턴스를 담은 future (검증 실패 시 ModelValidationException으로 완료)
     */
    public CompletableFuture<T> deserialize(Object data, DeserializeOptions options) {
        return ModelEngine.defaults().deserialize(this, data, options);
    }

    @Override
    public String toString() {
        return "ModelType{" + name() + '}';
    }
}
