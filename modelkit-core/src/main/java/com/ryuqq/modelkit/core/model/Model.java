package com.ryuqq.modelkit.core.model;

import com.ryuqq.modelkit.core.metadata.AttributeDescriptor;
import com.ryuqq.modelkit.core.serialization.SerializeOptions;
import com.ryuqq.modelkit.core.support.PlainObjects;
import com.ryuqq.modelkit.core.validation.ValidateOptions;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 모든 모델의 기반 클래스.
 *
 * <p>모델은 저장소와 무관하게 정의되며, 필드 값은 인스턴스별 Map에 보관됩니다.
 * 어떤 키가 속성이고 연관관계인지는 {@link com.ryuqq.modelkit.core.metadata.ModelType}에 등록된
 * 정의 테이블이 결정합니다.</p>
 *
 * <p><strong>생성 규칙:</strong></p>
 * <ol>
 *   <li>applyDefaults=true이면 기본값이 있는 모든 속성에 기본값 설정
 *       (지연 기본값은 이 시점에 계산, Map/List 고정값은 복사)</li>
 *   <li>전달된 data를 deep merge (호출자 값 우선, 양쪽이 Map이면 재귀 병합)</li>
 *   <li>생성 시에는 검증하지 않음</li>
 * </ol>
 *
 * <p><strong>정의 예시:</strong></p>
 * <pre>
 * public final class Tag extends Model {
 *
 *     public static final ModelType&lt;Tag&gt; TYPE = ModelType.define(Tag.class, Tag::new, b -&gt; b
 *         .attribute("label", Types.STRING));
 *
 *     public Tag(Map&lt;String, ?&gt; data, ConstructOptions options) {
 *         super(data, options);
 *     }
 *
 *     public String getLabel() {
 *         return get("label", String.class);
 *     }
 * }
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public abstract class Model {

    private final Map<String, Object> fields = new LinkedHashMap<>();

    /**
     * 기본값만 적용된 인스턴스 생성.
     */
    protected Model() {
        this(null, ConstructOptions.defaults());
    }

    /**
     * 인스턴스 생성.
     *
     * @param data 초기 데이터 (null 가능)
     * @param options 생성 옵션
     * @throws IllegalArgumentException options가 null인 경우
     * @throws com.ryuqq.modelkit.core.metadata.ModelDefinitionException 모델 타입이 정의되지 않은 경우
     */
    protected Model(Map<String, ?> data, ConstructOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (options.applyDefaults()) {
            Map<String, AttributeDescriptor> attributes = ModelEngine.defaults().metadata().getAttributes(getClass());
            for (Map.Entry<String, AttributeDescriptor> entry : attributes.entrySet()) {
                if (entry.getValue().hasDefault()) {
                    fields.put(entry.getKey(), entry.getValue().resolveDefault());
                }
            }
        }
        PlainObjects.deepMerge(fields, data);
    }

    /**
     * 필드 값 조회.
     *
     * @param key 필드 이름
     * @return 값 (없으면 null)
     */
    public Object get(String key) {
        return fields.get(key);
    }

    /**
     * 타입을 지정한 필드 값 조회.
     *
     * @param key 필드 이름
     * @param type 기대 타입
     * @param <V> 값 타입
     * @return 값 (없으면 null)
     * @throws ClassCastException 값이 기대 타입이 아닌 경우
     */
    public <V> V get(String key, Class<V> type) {
        return type.cast(fields.get(key));
    }

    /**
     * 필드 값 설정.
     *
     * @param key 필드 이름
     * @param value 값 (null 허용)
     * @return this
     */
    public Model set(String key, Object value) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        fields.put(key, value);
        return this;
    }

    /**
     * 필드 제거.
     *
     * @param key 필드 이름
     * @return 제거된 값 (없으면 null)
     */
    public Object unset(String key) {
        return fields.remove(key);
    }

    /**
     * 필드가 존재하는지 확인 (값이 null이어도 키가 있으면 true).
     *
     * @param key 필드 이름
     * @return 존재 여부
     */
    public boolean has(String key) {
        return fields.containsKey(key);
    }

    /**
     * 모든 필드의 읽기 전용 뷰.
     *
     * @return 필드 이름 → 값
     */
    public Map<String, Object> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public CompletableFuture<Map<String, Object>> serialize() {
        return serialize(SerializeOptions.defaults());
    }

    /**
     * 이 인스턴스를 plain object로 직렬화.
     *
     * <p>정의 테이블은 항상 런타임 클래스 기준으로 조회됩니다.</p>
     *
     * @param options 직렬화 옵션
     * @return plain object future
     */
    public CompletableFuture<Map<String, Object>> serialize(SerializeOptions options) {
        return ModelEngine.defaults().serialize(this, options);
    }

    public CompletableFuture<Void> validate() {
        return validate(ValidateOptions.defaults());
    }

    /**
     * 이 인스턴스 검증.
     *
     * @param options 검증 옵션
     * @return 성공 시 정상 완료, 실패 시 ModelValidationException으로 완료되는 future
     */
    public CompletableFuture<Void> validate(ValidateOptions options) {
        return ModelEngine.defaults().validate(this, options);
    }

    @Override
    public String toString() {
        // 연관관계 그래프는 순환할 수 있으므로 키만 출력
        return getClass().getSimpleName() + fields.keySet();
    }
}
