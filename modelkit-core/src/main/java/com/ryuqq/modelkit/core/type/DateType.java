package com.ryuqq.modelkit.core.type;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.List;
import java.util.function.Function;

/**
 * 날짜 속성 타입.
 *
 * <p>허용 값: {@link Instant}, {@link Date}.</p>
 *
 * <p><strong>문자열 해석 순서:</strong></p>
 * <ol>
 *   <li>ISO-8601 instant (2024-01-15T10:00:00Z)</li>
 *   <li>오프셋 포함 날짜시각 (2024-01-15T19:00:00+09:00)</li>
 *   <li>로컬 날짜시각, UTC로 간주 (2024-01-15T10:00:00)</li>
 *   <li>로컬 날짜, UTC 자정 (2024-01-15)</li>
 * </ol>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
final class DateType extends ScalarType implements DateAttributeType {

    private static final List<Function<String, Instant>> PARSERS = List.of(
        Instant::parse,
        text -> OffsetDateTime.parse(text).toInstant(),
        text -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC),
        text -> LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC)
    );

    DateType() {
        super("date", value -> value instanceof Instant || value instanceof Date);
    }

    @Override
    public Instant parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("text cannot be null");
        }
        String trimmed = text.trim();
        DateTimeParseException failure = null;
        for (Function<String, Instant> parser : PARSERS) {
            try {
                return parser.apply(trimmed);
            } catch (DateTimeParseException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        throw failure;
    }
}
