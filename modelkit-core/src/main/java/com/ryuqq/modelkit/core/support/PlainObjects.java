package com.ryuqq.modelkit.core.support;

import com.ryuqq.modelkit.core.model.Model;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain object(Map/List/스칼라) 조작 유틸리티.
 *
 * <p>Plain object는 {@code Map<String, Object>}로 표현되며,
 * 값은 스칼라, {@link java.time.Instant}, List 또는 중첩된 plain object입니다.</p>
 *
 * <p><strong>Deep merge 정책:</strong></p>
 * <ul>
 *   <li>양쪽 값이 모두 Map이면 재귀적으로 병합</li>
 *   <li>그 외에는 들어오는 값이 기존 값을 대체 (null 포함)</li>
 *   <li>들어오는 쪽에 키가 없으면 기존 값 유지</li>
 *   <li>들어오는 Map/List는 복사되어 저장 (호출자 데이터와 공유하지 않음)</li>
 * </ul>
 *
 * <p>List는 인덱스 단위로 병합하지 않고 통째로 대체합니다. 병합된 List는 길이가 다른
 * 두 배열의 원소가 섞인 모양이 되어 속성 값으로 의미가 없기 때문입니다.</p>
 *
 * <p>깊은 복사는 순환 참조를 보존합니다. 이미 복사한 노드는 같은 복사본으로 연결되므로
 * 순환하는 plain object 그래프도 유한한 시간에 복사됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class PlainObjects {

    // Utility class - prevent instantiation
    private PlainObjects() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * source를 target에 재귀적으로 병합.
     *
     * @param target 병합 대상 (변경됨)
     * @param source 병합할 데이터
     * @return target
     * @throws IllegalArgumentException target이 null인 경우
     */
    public static Map<String, Object> deepMerge(Map<String, Object> target, Map<String, ?> source) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (source == null) {
            return target;
        }
        for (Map.Entry<String, ?> entry : source.entrySet()) {
            String key = entry.getKey();
            Object incoming = entry.getValue();
            Object existing = target.get(key);

            if (existing instanceof Map && incoming instanceof Map) {
                Map<String, Object> merged = copyMap((Map<?, ?>) existing);
                deepMerge(merged, asStringKeyed((Map<?, ?>) incoming));
                target.put(key, merged);
            } else {
                target.put(key, deepCopy(incoming));
            }
        }
        return target;
    }

    /**
     * 값의 깊은 복사.
     *
     * <p>Map과 시퀀스(Collection, 배열)만 복사하며, 스칼라와 {@link Model} 인스턴스는
     * 참조를 그대로 반환합니다. 순환 참조는 복사본 안에서 같은 모양으로 유지됩니다.</p>
     *
     * @param value 복사할 값 (null 허용)
     * @return 복사된 값
     */
    public static Object deepCopy(Object value) {
        return deepCopy(value, new IdentityHashMap<>());
    }

    /**
     * Map의 깊은 복사 (키는 문자열로 변환).
     *
     * @param source 원본 Map
     * @return 새 LinkedHashMap
     */
    public static Map<String, Object> copyMap(Map<?, ?> source) {
        return copyMap(source, new IdentityHashMap<>());
    }

    /**
     * 지정한 키만 남긴 새 Map 생성.
     *
     * <p>source에 존재하는 키만 포함되며, 값이 null이어도 키가 있으면 포함됩니다.</p>
     *
     * @param source 원본 Map
     * @param keys 남길 키 목록
     * @return 새 Map (값은 깊은 복사)
     */
    public static Map<String, Object> pick(Map<String, ?> source, Set<String> keys) {
        Map<String, Object> picked = new LinkedHashMap<>();
        for (String key : keys) {
            if (source.containsKey(key)) {
                picked.put(key, deepCopy(source.get(key)));
            }
        }
        return picked;
    }

    /**
     * 값이 시퀀스(Collection 또는 배열)인지 확인.
     *
     * @param value 확인할 값
     * @return 시퀀스이면 true
     */
    public static boolean isSequence(Object value) {
        return value instanceof Collection || (value != null && value.getClass().isArray());
    }

    /**
     * 시퀀스를 순서를 유지한 List로 변환.
     *
     * @param value 시퀀스 값
     * @return List 뷰 또는 복사본
     * @throws IllegalArgumentException 시퀀스가 아닌 경우
     */
    public static List<Object> toList(Object value) {
        if (value instanceof List) {
            return Collections.unmodifiableList((List<?>) value);
        }
        if (value instanceof Collection) {
            return new ArrayList<>((Collection<?>) value);
        }
        if (value != null && value.getClass().isArray()) {
            int length = Array.getLength(value);
            List<Object> list = new ArrayList<>(length);
            for (int i = 0; i < length; i++) {
                list.add(Array.get(value, i));
            }
            return list;
        }
        throw new IllegalArgumentException("Value is not a sequence: " + describe(value));
    }

    /**
     * 값이 스칼라(문자열, 숫자, 불리언, 문자)인지 확인.
     *
     * @param value 확인할 값
     * @return 스칼라이면 true (null은 false)
     */
    public static boolean isScalar(Object value) {
        return value instanceof CharSequence
            || value instanceof Number
            || value instanceof Boolean
            || value instanceof Character;
    }

    /**
     * 로그/오류 메시지용 값 타입 설명.
     *
     * @param value 값
     * @return 타입 이름 (null이면 "null")
     */
    public static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }

    private static Object deepCopy(Object value, Map<Object, Object> copies) {
        if (value instanceof Map) {
            Object copied = copies.get(value);
            return copied != null ? copied : copyMap((Map<?, ?>) value, copies);
        }
        if (isSequence(value)) {
            Object copied = copies.get(value);
            if (copied != null) {
                return copied;
            }
            List<Object> source = toList(value);
            List<Object> copy = new ArrayList<>(source.size());
            copies.put(value, copy);
            for (Object element : source) {
                copy.add(deepCopy(element, copies));
            }
            return copy;
        }
        return value;
    }

    private static Map<String, Object> copyMap(Map<?, ?> source, Map<Object, Object> copies) {
        Map<String, Object> copy = new LinkedHashMap<>();
        copies.put(source, copy);
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            copy.put(String.valueOf(entry.getKey()), deepCopy(entry.getValue(), copies));
        }
        return copy;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, ?> asStringKeyed(Map<?, ?> map) {
        for (Object key : map.keySet()) {
            if (!(key instanceof String)) {
                return copyMap(map);
            }
        }
        return (Map<String, ?>) map;
    }
}
