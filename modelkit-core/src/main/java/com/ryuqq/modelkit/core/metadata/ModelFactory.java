package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;

import java.util.Map;

/**
 * 모델 인스턴스 생성자 참조.
 *
 * <p>보통 모델 클래스의 {@code (Map, ConstructOptions)} 생성자를 메서드 참조로 전달합니다.</p>
 *
 * <pre>
 * ModelType.define(User.class, User::new, b -&gt; ...);
 * </pre>
 *
 * @param <T> 모델 타입
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface ModelFactory<T extends Model> {

    /**
     * 인스턴스 생성.
     *
     * @param data 초기 데이터 (null 가능)
     * @param options 생성 옵션
     * @return 새 인스턴스
     */
    T create(Map<String, Object> data, ConstructOptions options);
}
