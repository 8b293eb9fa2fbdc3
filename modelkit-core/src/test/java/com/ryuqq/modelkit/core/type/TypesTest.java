package com.ryuqq.modelkit.core.type;

import com.ryuqq.modelkit.core.validation.PropertyValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.time.DateTimeException;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * 기본 제공 속성 타입 테스트.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
class TypesTest {

    private static void accepts(AttributeType type, Object value) {
        assertThatCode(() -> ((ValidatingAttributeType) type).validate("field", value)).doesNotThrowAnyException();
    }

    private static void rejects(AttributeType type, Object value) {
        PropertyValidationException exception = assertThrows(
            PropertyValidationException.class,
            () -> ((ValidatingAttributeType) type).validate("field", value)
        );
        assertThat(exception.getKind()).isEqualTo(Types.TYPE_ERROR);
        assertThat(exception.getMessage()).contains("field");
    }

    @Test
    void scalarTypes_AcceptMatchingValues() {
        accepts(Types.STRING, "text");
        accepts(Types.NUMBER, 1.5);
        accepts(Types.INTEGER, 3);
        accepts(Types.INTEGER, 3L);
        accepts(Types.INTEGER, 3.0);
        accepts(Types.INTEGER, BigInteger.TEN);
        accepts(Types.BOOLEAN, true);
        accepts(Types.OBJECT, Map.of());
        accepts(Types.ARRAY, List.of());
        accepts(Types.ARRAY, new Object[0]);
        accepts(Types.DATE, Instant.now());
        accepts(Types.DATE, new Date());
    }

    @Test
    void scalarTypes_RejectMismatchedValues() {
        rejects(Types.STRING, 1);
        rejects(Types.NUMBER, "1");
        rejects(Types.INTEGER, 3.5);
        rejects(Types.BOOLEAN, "true");
        rejects(Types.OBJECT, List.of());
        rejects(Types.ARRAY, "abc");
        rejects(Types.DATE, "2024-01-15");
    }

    @Test
    void allTypes_AcceptNull() {
        accepts(Types.STRING, null);
        accepts(Types.INTEGER, null);
        accepts(Types.DATE, null);
        accepts(Types.arrayOf(Types.STRING), null);
        accepts(Types.enumOf("a"), null);
    }

    @Test
    void any_IsNotValidating() {
        // When & Then
        assertThat(Types.ANY).isNotInstanceOf(ValidatingAttributeType.class);
        assertThat(Types.ANY.name()).isEqualTo("any");
    }

    @Test
    void enumOf_RejectsValueOutsideAllowedSet() {
        // Given
        AttributeType role = Types.enumOf("member", "admin");

        // When & Then
        accepts(role, "admin");
        rejects(role, "owner");
    }

    @Test
    void enumOf_NoValues_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> Types.enumOf()).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void arrayOf_ReportsFirstInvalidElementIndex() {
        // Given
        AttributeType tags = Types.arrayOf(Types.STRING);

        // When & Then
        accepts(tags, List.of("a", "b"));
        assertThatThrownBy(() -> ((ValidatingAttributeType) tags).validate("tags", List.of("a", 2)))
            .isInstanceOf(PropertyValidationException.class)
            .hasMessageContaining("tags[1]");
        assertThat(tags.name()).isEqualTo("array<string>");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "2024-01-15T10:00:00Z",
        "2024-01-15T19:00:00+09:00",
        "2024-01-15T10:00:00",
        " 2024-01-15T10:00:00Z "
    })
    void date_Parse_AcceptsIsoVariants(String text) {
        // When
        Instant parsed = ((DateAttributeType) Types.DATE).parse(text);

        // Then
        assertThat(parsed).isEqualTo(Instant.parse("2024-01-15T10:00:00Z"));
    }

    @Test
    void date_Parse_LocalDateIsUtcMidnight() {
        // When
        Instant parsed = ((DateAttributeType) Types.DATE).parse("2024-01-15");

        // Then
        assertThat(parsed).isEqualTo(Instant.parse("2024-01-15T00:00:00Z"));
    }

    @Test
    void date_Parse_Garbage_ThrowsWithSuppressedAttempts() {
        // When & Then
        assertThatThrownBy(() -> ((DateAttributeType) Types.DATE).parse("not-a-date"))
            .isInstanceOf(DateTimeException.class)
            .satisfies(e -> assertThat(e.getSuppressed()).hasSize(3));
    }

    @Test
    void customScalarType_UsesPredicate() {
        // Given
        AttributeType even = new ScalarType("even", v -> v instanceof Integer && ((Integer) v) % 2 == 0);

        // When & Then
        accepts(even, 4);
        rejects(even, 3);
        assertThat(even.name()).isEqualTo("even");
    }
}
