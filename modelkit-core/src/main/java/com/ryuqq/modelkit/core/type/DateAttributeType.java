package com.ryuqq.modelkit.core.type;

import java.time.Instant;

/**
 * 날짜 속성 타입.
 *
 * <p>역직렬화 시 문자열 값은 {@link #parse(String)}로 {@link Instant}로 변환됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public interface DateAttributeType extends AttributeType {

    /**
     * 문자열을 날짜로 변환.
     *
     * @param text 날짜 문자열
     * @return 변환된 시각
     * @throws java.time.format.DateTimeParseException 해석할 수 없는 경우
     */
    Instant parse(String text);
}
