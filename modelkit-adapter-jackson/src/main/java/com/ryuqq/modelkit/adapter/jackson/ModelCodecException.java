package com.ryuqq.modelkit.adapter.jackson;

/**
 * JSON 변환 실패.
 *
 * <p>잘못된 JSON, 객체가 아닌 최상위 값, 변환할 수 없는 타입 등 Jackson 처리 오류를
 * 감쌉니다. 원인 예외는 항상 보존됩니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class ModelCodecException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ModelCodecException(String message) {
        super(message);
    }

    public ModelCodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
