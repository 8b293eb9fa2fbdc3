package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.type.AttributeType;
import com.ryuqq.modelkit.core.validation.ValidationRule;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * 모델 타입 하나의 정적 정의 테이블.
 *
 * <p>속성, 연관관계, 속성별 검증 규칙을 선언 순서대로 보관합니다.
 * 생성 후에는 변경할 수 없습니다.</p>
 *
 * <p><strong>정의 예시:</strong></p>
 * <pre>
 * ModelDescriptor descriptor = ModelDescriptor.builder()
 *     .attribute("name", Types.STRING)
 *     .attribute("role", Types.STRING, "member")
 *     .lazyAttribute("tags", Types.ARRAY, ArrayList::new)
 *     .optionalAttribute("bio", Types.STRING)
 *     .hasMany("posts", TargetRef.deferred(() -&gt; Post.TYPE))
 *     .validate("name", Rules.LENGTH, Map.of("min", 1, "max", 50))
 *     .build();
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelDescriptor {

    private final String name;
    private final Map<String, AttributeDescriptor> attributes;
    private final Map<String, AssociationDescriptor> associations;
    private final Map<String, List<ValidationDescriptor>> validations;

    private ModelDescriptor(Builder builder) {
        this.name = builder.name;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(builder.attributes));
        this.associations = Collections.unmodifiableMap(new LinkedHashMap<>(builder.associations));
        Map<String, List<ValidationDescriptor>> copy = new LinkedHashMap<>();
        builder.validations.forEach((key, list) -> copy.put(key, List.copyOf(list)));
        this.validations = Collections.unmodifiableMap(copy);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 모델 이름.
     *
     * <p>{@link ModelType#define}과 {@link ModelType#extend}로 등록한 디스크립터는 항상
     * 모델 클래스의 simple name을 가집니다. 빌더를 직접 사용하면서 이름을 지정하지 않은
     * 경우에만 null입니다.</p>
     *
     * @return 모델 이름 (빌더에서 지정하지 않았으면 null)
     */
    public String name() {
        return name;
    }

    public Map<String, AttributeDescriptor> attributes() {
        return attributes;
    }

    public Map<String, AssociationDescriptor> associations() {
        return associations;
    }

    /**
     * 속성에 등록된 검증 규칙 조회.
     *
     * @param attribute 속성 이름
     * @return 등록 순서대로의 검증 규칙 (없으면 빈 리스트)
     */
    public List<ValidationDescriptor> validations(String attribute) {
        return validations.getOrDefault(attribute, List.of());
    }

    @Override
    public String toString() {
        return "ModelDescriptor{"
            + "name=" + name
            + ", attributes=" + attributes.keySet()
            + ", associations=" + associations.keySet()
            + '}';
    }

    /**
     * ModelDescriptor 빌더.
     */
    public static final class Builder {

        private String name;
        private final Map<String, AttributeDescriptor> attributes = new LinkedHashMap<>();
        private final Map<String, AssociationDescriptor> associations = new LinkedHashMap<>();
        private final Map<String, List<ValidationDescriptor>> validations = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * 부모 정의의 속성, 연관관계, 검증 규칙을 모두 상속.
         *
         * <p>이후 같은 이름으로 선언하면 부모 정의를 덮어씁니다.</p>
         *
         * @param parent 부모 정의
         * @return this
         */
        public Builder inherit(ModelDescriptor parent) {
            if (parent == null) {
                throw new IllegalArgumentException("parent cannot be null");
            }
            attributes.putAll(parent.attributes);
            associations.putAll(parent.associations);
            parent.validations.forEach((key, list) ->
                validations.computeIfAbsent(key, k -> new ArrayList<>()).addAll(list));
            return this;
        }

        /**
         * 필수 속성 (기본값 없음).
         */
        public Builder attribute(String name, AttributeType type) {
            return attribute(name, new AttributeDescriptor(type, null, false));
        }

        /**
         * 고정 기본값을 가진 속성.
         */
        public Builder attribute(String name, AttributeType type, Object defaultValue) {
            return attribute(name, new AttributeDescriptor(type, DefaultValue.of(defaultValue), false));
        }

        /**
         * 생성 시점마다 계산되는 기본값을 가진 속성.
         */
        public Builder lazyAttribute(String name, AttributeType type, Supplier<?> defaultSupplier) {
            return attribute(name, new AttributeDescriptor(type, DefaultValue.lazy(defaultSupplier), false));
        }

        public Builder optionalAttribute(String name, AttributeType type) {
            return attribute(name, new AttributeDescriptor(type, null, true));
        }

        /**
         * 속성 정의 등록.
         *
         * @param name 속성 이름
         * @param descriptor 속성 정의
         * @return this
         * @throws IllegalArgumentException 이름이 비어 있거나 연관관계 이름과 겹치는 경우
         */
        public Builder attribute(String name, AttributeDescriptor descriptor) {
            requireName(name);
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptor cannot be null");
            }
            if (associations.containsKey(name)) {
                throw new IllegalArgumentException("'" + name + "' is already declared as an association");
            }
            attributes.put(name, descriptor);
            return this;
        }

        public Builder hasOne(String name, TargetRef target) {
            return association(name, new AssociationDescriptor(AssociationKind.HAS_ONE, target));
        }

        public Builder belongsTo(String name, TargetRef target) {
            return association(name, new AssociationDescriptor(AssociationKind.BELONGS_TO_ONE, target));
        }

        public Builder hasMany(String name, TargetRef target) {
            return association(name, new AssociationDescriptor(AssociationKind.HAS_MANY, target));
        }

        public Builder manyToMany(String name, TargetRef target) {
            return association(name, new AssociationDescriptor(AssociationKind.MANY_TO_MANY, target));
        }

        /**
         * 연관관계 정의 등록.
         *
         * @param name 연관관계 이름
         * @param descriptor 연관관계 정의
         * @return this
         * @throws IllegalArgumentException 이름이 비어 있거나 속성 이름과 겹치는 경우
         */
        public Builder association(String name, AssociationDescriptor descriptor) {
            requireName(name);
            if (descriptor == null) {
                throw new IllegalArgumentException("descriptor cannot be null");
            }
            if (attributes.containsKey(name)) {
                throw new IllegalArgumentException("'" + name + "' is already declared as an attribute");
            }
            associations.put(name, descriptor);
            return this;
        }

        public Builder validate(String attribute, ValidationRule rule) {
            return validate(attribute, rule, Map.of());
        }

        /**
         * 속성에 사용자 정의 검증 규칙 등록.
         *
         * @param attribute 속성 이름 (먼저 선언되어 있어야 함)
         * @param rule 검증 규칙
         * @param options 규칙에 전달될 옵션
         * @return this
         * @throws IllegalArgumentException 선언되지 않은 속성인 경우
         */
        public Builder validate(String attribute, ValidationRule rule, Map<String, ?> options) {
            if (!attributes.containsKey(attribute)) {
                throw new IllegalArgumentException("Cannot add a validation to undeclared attribute '" + attribute + "'");
            }
            Map<String, Object> copied = options == null ? null : new LinkedHashMap<>(options);
            validations.computeIfAbsent(attribute, k -> new ArrayList<>())
                .add(new ValidationDescriptor(rule, copied));
            return this;
        }

        public ModelDescriptor build() {
            return new ModelDescriptor(this);
        }

        private static void requireName(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
        }
    }
}
