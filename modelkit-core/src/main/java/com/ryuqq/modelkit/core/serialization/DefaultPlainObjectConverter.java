package com.ryuqq.modelkit.core.serialization;

import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.spi.PlainObjectConverter;
import com.ryuqq.modelkit.core.support.PlainObjects;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Core {@link PlainObjectConverter}.
 *
 * <p>Supports {@link Map} input (deep-copied) and {@link Model} instances
 * (their field store, deep-copied). Anything else is rejected; use the Jackson
 * adapter for arbitrary beans.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class DefaultPlainObjectConverter implements PlainObjectConverter {

    @Override
    public Map<String, Object> toPlainObject(Object value) {
        if (value == null) {
            return new LinkedHashMap<>();
        }
        if (value instanceof Map) {
            return PlainObjects.copyMap((Map<?, ?>) value);
        }
        if (value instanceof Model) {
            return PlainObjects.copyMap(((Model) value).fields());
        }
        return convertForeign(value);
    }

    /**
     * Converts a value that is neither a map nor a model.
     *
     * @param value the foreign value
     * @return a plain object
     * @throws IllegalArgumentException always, in the core implementation
     */
    protected Map<String, Object> convertForeign(Object value) {
        throw new IllegalArgumentException(
            "Cannot convert " + PlainObjects.describe(value) + " to a plain object");
    }
}
