package com.ryuqq.modelkit.adapter.jackson;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.modelkit.core.serialization.DefaultPlainObjectConverter;
import com.ryuqq.modelkit.core.support.PlainObjects;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Jackson 기반 {@link com.ryuqq.modelkit.core.spi.PlainObjectConverter}.
 *
 * <p>Map과 Model 입력은 기본 구현과 동일하게 처리하고, 그 외의 객체
 * (bean, record, {@link JsonNode})는 {@link ObjectMapper#convertValue}로 변환합니다.</p>
 *
 * <p>날짜 필드는 매퍼 설정에 따라 ISO-8601 문자열이 되며, 역직렬화 시
 * 날짜 타입 속성에서 다시 Instant로 변환됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class JacksonPlainObjectConverter extends DefaultPlainObjectConverter {

    static final TypeReference<LinkedHashMap<String, Object>> PLAIN_OBJECT = new TypeReference<>() { };

    private final ObjectMapper objectMapper;

    /**
     * 생성자.
     *
     * @param objectMapper 변환에 사용할 매퍼
     * @throws IllegalArgumentException objectMapper가 null인 경우
     */
    public JacksonPlainObjectConverter(ObjectMapper objectMapper) {
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.objectMapper = objectMapper;
    }

    /**
     * 객체 형태의 값을 plain object로 변환.
     *
     * @param value 변환할 값
     * @return plain object
     * @throws ModelCodecException JSON 객체로 표현되지 않는 값인 경우
     */
    @Override
    protected Map<String, Object> convertForeign(Object value) {
        if (value instanceof JsonNode && !((JsonNode) value).isObject()) {
            throw new ModelCodecException(
                "Expected a JSON object but got " + ((JsonNode) value).getNodeType());
        }
        try {
            return objectMapper.convertValue(value, PLAIN_OBJECT);
        } catch (IllegalArgumentException e) {
            throw new ModelCodecException(
                "Cannot convert " + PlainObjects.describe(value) + " to a plain object", e);
        }
    }
}
