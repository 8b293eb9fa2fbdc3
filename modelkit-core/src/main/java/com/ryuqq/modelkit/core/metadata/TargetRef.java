package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.model.Model;

import java.util.function.Supplier;

/**
 * 연관관계 대상 모델 타입 참조.
 *
 * <ul>
 *   <li>{@link Direct}: 정의 시점에 이미 존재하는 타입</li>
 *   <li>{@link Deferred}: 사용 시점에 해석되는 타입 (순환 참조 정의용)</li>
 * </ul>
 *
 * <p>{@link #resolve()}는 여러 번 호출해도 안전하며,
 * 해석에 실패하면 {@link ModelDefinitionException}을 발생시킵니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public sealed interface TargetRef permits TargetRef.Direct, TargetRef.Deferred {

    /**
     * 대상 모델 타입 해석.
     *
     * @return 대상 모델 타입
     * @throws ModelDefinitionException 해석할 수 없는 경우
     */
    ModelType<?> resolve();

    /**
     * 지연 해석 참조인지 확인.
     *
     * @return Deferred인 경우 true
     */
    default boolean isDeferred() {
        return this instanceof Deferred;
    }

    static TargetRef to(ModelType<?> type) {
        return new Direct(type);
    }

    static TargetRef deferred(Supplier<? extends ModelType<?>> supplier) {
        return new Deferred(supplier);
    }

    /**
     * 클래스 기반 지연 참조.
     *
     * @param modelClass 대상 모델 클래스
     * @return 사용 시점에 {@link ModelType#of(Class)}로 해석되는 참조
     */
    static TargetRef to(Class<? extends Model> modelClass) {
        if (modelClass == null) {
            throw new IllegalArgumentException("modelClass cannot be null");
        }
        return new Deferred(() -> ModelType.of(modelClass));
    }

    /**
     * 즉시 참조.
     *
     * @param type 대상 타입
     */
    record Direct(ModelType<?> type) implements TargetRef {

        public Direct {
            if (type == null) {
                throw new IllegalArgumentException("type cannot be null (use TargetRef.deferred for circular references)");
            }
        }

        @Override
        public ModelType<?> resolve() {
            return type;
        }
    }

    /**
     * 지연 참조.
     *
     * @param supplier 대상 타입 공급자
     */
    record Deferred(Supplier<? extends ModelType<?>> supplier) implements TargetRef {

        public Deferred {
            if (supplier == null) {
                throw new IllegalArgumentException("supplier cannot be null");
            }
        }

        @Override
        public ModelType<?> resolve() {
            ModelType<?> type;
            try {
                type = supplier.get();
            } catch (ModelDefinitionException e) {
                throw e;
            } catch (RuntimeException e) {
                throw new ModelDefinitionException("Association target could not be resolved", e);
            }
            if (type == null) {
                throw new ModelDefinitionException("Association target resolved to null");
            }
            return type;
        }
    }
}
