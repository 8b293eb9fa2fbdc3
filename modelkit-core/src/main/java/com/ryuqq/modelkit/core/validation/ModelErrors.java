package com.ryuqq.modelkit.core.validation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 모델 검증 오류 리포트.
 *
 * <p>속성 이름 → 오류 목록(발생 순서)의 매핑입니다. 비어 있으면 검증 성공입니다.</p>
 *
 * <p>같은 속성에 대한 오류는 교체되지 않고 누적됩니다 ({@link #append(String, List)}).</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class ModelErrors {

    private final Map<String, List<PropertyError>> errors = new LinkedHashMap<>();

    /**
     * 속성 오류 추가 (기존 오류 뒤에 이어붙임).
     *
     * @param attribute 속성 이름
     * @param attributeErrors 추가할 오류 목록
     * @return this
     */
    public ModelErrors append(String attribute, List<PropertyError> attributeErrors) {
        if (attribute == null) {
            throw new IllegalArgumentException("attribute cannot be null");
        }
        if (attributeErrors == null || attributeErrors.isEmpty()) {
            return this;
        }
        errors.computeIfAbsent(attribute, k -> new ArrayList<>()).addAll(attributeErrors);
        return this;
    }

    public boolean isEmpty() {
        return errors.isEmpty();
    }

    /**
     * 오류가 있는 속성 이름 (발생 순서).
     *
     * @return 속성 이름 집합
     */
    public Set<String> attributes() {
        return Collections.unmodifiableSet(errors.keySet());
    }

    /**
     * 속성의 오류 목록.
     *
     * @param attribute 속성 이름
     * @return 오류 목록 (없으면 빈 리스트)
     */
    public List<PropertyError> get(String attribute) {
        List<PropertyError> list = errors.get(attribute);
        return list == null ? List.of() : Collections.unmodifiableList(list);
    }

    /**
     * 특정 종류의 오류가 있는지 확인.
     *
     * @param attribute 속성 이름
     * @param kind 오류 종류
     * @return 존재하면 true
     */
    public boolean has(String attribute, String kind) {
        return get(attribute).stream().anyMatch(error -> error.kind().equals(kind));
    }

    /**
     * 읽기 전용 Map 뷰.
     *
     * @return 속성 이름 → 오류 목록
     */
    public Map<String, List<PropertyError>> asMap() {
        Map<String, List<PropertyError>> view = new LinkedHashMap<>();
        errors.forEach((key, list) -> view.put(key, List.copyOf(list)));
        return Collections.unmodifiableMap(view);
    }

    @Override
    public String toString() {
        return "ModelErrors" + errors;
    }
}
