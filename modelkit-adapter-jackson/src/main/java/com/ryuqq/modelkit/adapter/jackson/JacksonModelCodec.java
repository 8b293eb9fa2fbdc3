package com.ryuqq.modelkit.adapter.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.model.ModelEngine;
import com.ryuqq.modelkit.core.serialization.DeserializeOptions;
import com.ryuqq.modelkit.core.serialization.SerializeOptions;
import com.ryuqq.modelkit.core.support.Futures;
import com.ryuqq.modelkit.core.support.PlainObjects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * 모델 ↔ JSON 문자열 변환기.
 *
 * <p>직렬화/역직렬화 자체는 {@link ModelEngine}이 담당하고, 이 클래스는
 * plain object와 JSON 텍스트 사이의 변환만 수행합니다.</p>
 *
 * <p><strong>예외 변환:</strong> {@link JsonProcessingException} 등 Jackson 처리 오류는
 * {@link ModelCodecException}으로 바뀌어 반환된 future의 실패로 전달됩니다.
 * 검증 실패는 {@link com.ryuqq.modelkit.core.validation.ModelValidationException} 그대로 전달됩니다.</p>
 *
 * <pre>
 * JacksonModelCodec codec = JacksonModelCodec.create();
 *
 * String json = codec.toJson(author, SerializeOptions.defaults()).join();
 * Author copy = codec.fromJson(Author.TYPE, json, DeserializeOptions.defaults()).join();
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class JacksonModelCodec {

    private static final Logger log = LoggerFactory.getLogger(JacksonModelCodec.class);

    private static final TypeReference<List<Object>> PLAIN_ARRAY = new TypeReference<>() { };

    private final ModelEngine engine;
    private final ObjectMapper objectMapper;

    /**
     * 생성자.
     *
     * @param engine 직렬화/역직렬화 엔진
     * @param objectMapper JSON 매퍼
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public JacksonModelCodec(ModelEngine engine, ObjectMapper objectMapper) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (objectMapper == null) {
            throw new IllegalArgumentException("objectMapper cannot be null");
        }
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    /**
     * 기본 매퍼와 Jackson 변환기를 사용하는 codec 생성.
     *
     * @return 새 codec
     */
    public static JacksonModelCodec create() {
        ObjectMapper mapper = defaultObjectMapper();
        ModelEngine engine = ModelEngine.builder()
            .converter(new JacksonPlainObjectConverter(mapper))
            .build();
        return new JacksonModelCodec(engine, mapper);
    }

    /**
     * 날짜를 ISO-8601 문자열로 쓰는 ObjectMapper.
     *
     * @return 새 ObjectMapper
     */
    public static ObjectMapper defaultObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    public ModelEngine engine() {
        return engine;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    /**
     * 인스턴스를 JSON 객체 문자열로 직렬화.
     *
     * @param instance 직렬화할 인스턴스
     * @param options 직렬화 옵션
     * @return JSON 문자열 future
     */
    public CompletableFuture<String> toJson(Model instance, SerializeOptions options) {
        return engine.serialize(instance, options).thenApply(this::write);
    }

    /**
     * 인스턴스 목록을 JSON 배열 문자열로 직렬화 (순서 유지).
     *
     * @param instances 직렬화할 인스턴스 목록
     * @param options 직렬화 옵션
     * @return JSON 문자열 future
     */
    public CompletableFuture<String> toJsonArray(List<? extends Model> instances, SerializeOptions options) {
        if (instances == null) {
            throw new IllegalArgumentException("instances cannot be null");
        }
        List<CompletableFuture<Map<String, Object>>> pending = new ArrayList<>(instances.size());
        for (Model instance : instances) {
            pending.add(engine.serialize(instance, options));
        }
        return Futures.allAsList(pending).thenApply(this::write);
    }

    /**
     * JSON 객체 문자열을 인스턴스로 역직렬화.
     *
     * @param type 대상 모델 타입
     * @param json JSON 문자열
     * @param options 역직렬화 옵션
     * @param <T> 모델 타입
     * @return 인스턴스 future (JSON 오류 시 ModelCodecException으로 완료)
     */
    public <T extends Model> CompletableFuture<T> fromJson(ModelType<T> type, String json, DeserializeOptions options) {
        Map<String, Object> plain;
        try {
            plain = readObject(json);
        } catch (ModelCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        return engine.deserialize(type, plain, options);
    }

    /**
     * JSON 배열 문자열을 인스턴스 목록으로 역직렬화 (원소는 동시에 처리, 순서 유지).
     *
     * @param type 대상 모델 타입
     * @param json JSON 배열 문자열
     * @param options 역직렬화 옵션
     * @param <T> 모델 타입
     * @return 인스턴스 목록 future (객체가 아닌 원소가 있으면 ModelCodecException)
     */
    public <T extends Model> CompletableFuture<List<T>> fromJsonArray(
        ModelType<T> type,
        String json,
        DeserializeOptions options
    ) {
        List<Object> elements;
        try {
            elements = read(json, PLAIN_ARRAY);
            requireObjects(elements);
        } catch (ModelCodecException e) {
            return CompletableFuture.failedFuture(e);
        }
        log.debug("Deserializing {} {} elements from JSON array", elements.size(), type.name());
        List<CompletableFuture<T>> pending = new ArrayList<>(elements.size());
        for (Object element : elements) {
            pending.add(engine.deserialize(type, element, options));
        }
        return Futures.allAsList(pending);
    }

    private static void requireObjects(List<Object> elements) {
        for (int i = 0; i < elements.size(); i++) {
            Object element = elements.get(i);
            if (!(element instanceof Map)) {
                throw new ModelCodecException(
                    "JSON array element " + i + " is not an object: " + PlainObjects.describe(element));
            }
        }
    }

    private Map<String, Object> readObject(String json) {
        return read(json, JacksonPlainObjectConverter.PLAIN_OBJECT);
    }

    private <V> V read(String json, TypeReference<V> valueType) {
        if (json == null) {
            throw new ModelCodecException("json cannot be null");
        }
        try {
            V value = objectMapper.readValue(json, valueType);
            if (value == null) {
                throw new ModelCodecException("JSON document is null");
            }
            return value;
        } catch (JsonProcessingException e) {
            log.warn("Malformed JSON input: {}", e.getOriginalMessage());
            throw new ModelCodecException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private String write(Object plain) {
        try {
            return objectMapper.writeValueAsString(plain);
        } catch (JsonProcessingException e) {
            throw new ModelCodecException("Cannot write JSON: " + e.getOriginalMessage(), e);
        }
    }
}
