package com.ryuqq.modelkit.core.validation;

import com.ryuqq.modelkit.core.support.PlainObjects;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 기본 제공 검증 규칙.
 *
 * <p>모든 규칙은 null 값을 통과시킵니다. 필수 여부는 검증 엔진이 판단합니다.</p>
 *
 * <ul>
 *   <li>{@link #LENGTH}: 문자열 길이 또는 시퀀스 크기 (옵션 min, max)</li>
 *   <li>{@link #RANGE}: 숫자 범위 (옵션 min, max)</li>
 *   <li>{@link #PATTERN}: 정규식 전체 일치 (옵션 regex)</li>
 *   <li>{@link #EMAIL}: 이메일 형식</li>
 * </ul>
 *
 * <pre>
 * b.validate("name", Rules.LENGTH, Map.of("min", 2, "max", 30));
 * b.validate("code", Rules.PATTERN, Map.of("regex", "^[A-Z]{3}$"));
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class Rules {

    public static final String LENGTH_ERROR = "attribute.length";
    public static final String RANGE_ERROR = "attribute.range";
    public static final String PATTERN_ERROR = "attribute.pattern";
    public static final String EMAIL_ERROR = "attribute.email";

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("^[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}$");

    public static final ValidationRule LENGTH = Rules::checkLength;

    public static final ValidationRule RANGE = Rules::checkRange;

    public static final ValidationRule PATTERN = Rules::checkPattern;

    public static final ValidationRule EMAIL = (key, value, options) -> {
        if (value != null && !EMAIL_PATTERN.matcher(String.valueOf(value)).matches()) {
            throw new PropertyValidationException(EMAIL_ERROR,
                String.format("Value of '%s' must be a valid email address", key));
        }
    };

    // Utility class - prevent instantiation
    private Rules() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    private static void checkLength(String key, Object value, Map<String, Object> options) {
        if (value == null) {
            return;
        }
        int length;
        if (value instanceof CharSequence) {
            length = ((CharSequence) value).length();
        } else if (PlainObjects.isSequence(value)) {
            length = PlainObjects.toList(value).size();
        } else {
            throw new PropertyValidationException(LENGTH_ERROR,
                String.format("Length of '%s' cannot be measured (%s)", key, PlainObjects.describe(value)));
        }
        Number min = number(options, "min");
        Number max = number(options, "max");
        if (min != null && length < min.intValue()) {
            throw new PropertyValidationException(LENGTH_ERROR,
                String.format("Length of '%s' must be at least %d", key, min.intValue()));
        }
        if (max != null && length > max.intValue()) {
            throw new PropertyValidationException(LENGTH_ERROR,
                String.format("Length of '%s' must be at most %d", key, max.intValue()));
        }
    }

    private static void checkRange(String key, Object value, Map<String, Object> options) {
        if (value == null) {
            return;
        }
        if (!(value instanceof Number)) {
            throw new PropertyValidationException(RANGE_ERROR,
                String.format("Value of '%s' must be a number", key));
        }
        BigDecimal actual = new BigDecimal(value.toString());
        Number min = number(options, "min");
        Number max = number(options, "max");
        if (min != null && actual.compareTo(new BigDecimal(min.toString())) < 0) {
            throw new PropertyValidationException(RANGE_ERROR,
                String.format("Value of '%s' must be at least %s", key, min));
        }
        if (max != null && actual.compareTo(new BigDecimal(max.toString())) > 0) {
            throw new PropertyValidationException(RANGE_ERROR,
                String.format("Value of '%s' must be at most %s", key, max));
        }
    }

    private static void checkPattern(String key, Object value, Map<String, Object> options) {
        Object regex = options.get("regex");
        if (!(regex instanceof String)) {
            throw new IllegalArgumentException("PATTERN rule requires a 'regex' option");
        }
        if (value == null) {
            return;
        }
        if (!Pattern.compile((String) regex).matcher(String.valueOf(value)).matches()) {
            throw new PropertyValidationException(PATTERN_ERROR,
                String.format("Value of '%s' does not match %s", key, regex));
        }
    }

    private static Number number(Map<String, Object> options, String name) {
        Object option = options.get(name);
        if (option == null) {
            return null;
        }
        if (!(option instanceof Number)) {
            throw new IllegalArgumentException("Rule option '" + name + "' must be a number (current: " + option + ")");
        }
        return (Number) option;
    }
}
