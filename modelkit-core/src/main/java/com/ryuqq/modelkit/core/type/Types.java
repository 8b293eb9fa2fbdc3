package com.ryuqq.modelkit.core.type;

import com.ryuqq.modelkit.core.support.PlainObjects;
import com.ryuqq.modelkit.core.validation.PropertyValidationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * 기본 제공 속성 타입.
 *
 * <p>모든 타입은 null 값을 허용하며, 실패 시 종류 {@value #TYPE_ERROR}의
 * {@link PropertyValidationException}을 던집니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class Types {

    /**
     * 타입 불일치 오류 종류.
     */
    public static final String TYPE_ERROR = "attribute.type";

    public static final AttributeType STRING = new ScalarType("string", v -> v instanceof CharSequence);

    public static final AttributeType NUMBER = new ScalarType("number", v -> v instanceof Number);

    public static final AttributeType INTEGER = new ScalarType("integer", Types::isIntegral);

    public static final AttributeType BOOLEAN = new ScalarType("boolean", v -> v instanceof Boolean);

    public static final AttributeType OBJECT = new ScalarType("object", v -> v instanceof Map);

    public static final AttributeType ARRAY = new ScalarType("array", PlainObjects::isSequence);

    /**
     * 날짜 타입. 역직렬화 시 문자열이 {@link java.time.Instant}로 변환됩니다.
     */
    public static final AttributeType DATE = new DateType();

    /**
     * 검증하지 않는 타입.
     */
    public static final AttributeType ANY = () -> "any";

    // Utility class - prevent instantiation
    private Types() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 원소 타입이 지정된 시퀀스 타입.
     *
     * @param elementType 원소 타입
     * @return 시퀀스 타입
     */
    public static AttributeType arrayOf(AttributeType elementType) {
        return new ArrayType(elementType);
    }

    /**
     * 허용 값 목록 중 하나여야 하는 타입.
     *
     * @param values 허용 값
     * @return 열거 타입
     * @throws IllegalArgumentException 허용 값이 비어 있는 경우
     */
    public static AttributeType enumOf(Object... values) {
        if (values == null || values.length == 0) {
            throw new IllegalArgumentException("values cannot be null or empty");
        }
        Set<Object> allowed = Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values)));
        return new ValidatingAttributeType() {
            @Override
            public String name() {
                return "enum" + allowed;
            }

            @Override
            public void validate(String key, Object value) {
                if (value != null && !allowed.contains(value)) {
                    throw new PropertyValidationException(
                        TYPE_ERROR,
                        String.format("Value of '%s' must be one of %s", key, allowed)
                    );
                }
            }
        };
    }

    private static boolean isIntegral(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return true;
        }
        if (value instanceof java.math.BigInteger) {
            return true;
        }
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            return !Double.isInfinite(d) && d == Math.rint(d);
        }
        return false;
    }
}
