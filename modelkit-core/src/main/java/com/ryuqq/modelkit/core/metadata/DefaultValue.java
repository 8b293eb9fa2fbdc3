package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.support.PlainObjects;

import java.util.function.Supplier;

/**
 * 속성 기본값.
 *
 * <p>두 가지 형태가 있습니다:</p>
 * <ul>
 *   <li>{@link Constant}: 정의 시점에 고정된 값. Map/List 값은 인스턴스마다 복사됩니다.</li>
 *   <li>{@link Lazy}: 인스턴스 생성 시점에 매번 호출되는 Supplier.
 *       다른 모델 타입을 참조하는 기본값의 순환 정의를 피할 때 사용합니다.</li>
 * </ul>
 *
 * <pre>
 * DefaultValue.of("guest");
 * DefaultValue.lazy(ArrayList::new);
 * DefaultValue.lazy(() -&gt; Profile.TYPE.create());
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public sealed interface DefaultValue permits DefaultValue.Constant, DefaultValue.Lazy {

    /**
     * 기본값의 구체 값 계산.
     *
     * @return 새로 계산(또는 복사)된 값
     */
    Object resolve();

    /**
     * 지연 계산 기본값인지 확인.
     *
     * @return Lazy인 경우 true
     */
    default boolean isLazy() {
        return this instanceof Lazy;
    }

    /**
     * 고정 기본값 생성.
     *
     * @param value 기본값 (null 불가)
     * @return Constant
     */
    static DefaultValue of(Object value) {
        return new Constant(value);
    }

    /**
     * 지연 계산 기본값 생성.
     *
     * @param supplier 값 공급자
     * @return Lazy
     */
    static DefaultValue lazy(Supplier<?> supplier) {
        return new Lazy(supplier);
    }

    /**
     * 고정 기본값.
     *
     * @param value 기본값
     */
    record Constant(Object value) implements DefaultValue {

        public Constant {
            if (value == null) {
                throw new IllegalArgumentException("default value cannot be null");
            }
        }

        @Override
        public Object resolve() {
            return PlainObjects.deepCopy(value);
        }
    }

    /**
     * 지연 계산 기본값.
     *
     * @param supplier 값 공급자
     */
    record Lazy(Supplier<?> supplier) implements DefaultValue {

        public Lazy {
            if (supplier == null) {
                throw new IllegalArgumentException("supplier cannot be null");
            }
        }

        @Override
        public Object resolve() {
            return supplier.get();
        }
    }
}
