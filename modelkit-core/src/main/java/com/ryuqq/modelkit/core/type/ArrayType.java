package com.ryuqq.modelkit.core.type;

import com.ryuqq.modelkit.core.support.PlainObjects;
import com.ryuqq.modelkit.core.validation.PropertyValidationException;

import java.util.List;

/**
 * 원소 타입이 지정된 시퀀스 타입.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
final class ArrayType implements ValidatingAttributeType {

    private final AttributeType elementType;

    ArrayType(AttributeType elementType) {
        if (elementType == null) {
            throw new IllegalArgumentException("elementType cannot be null");
        }
        this.elementType = elementType;
    }

    @Override
    public String name() {
        return "array<" + elementType.name() + ">";
    }

    @Override
    public void validate(String key, Object value) {
        if (value == null) {
            return;
        }
        if (!PlainObjects.isSequence(value)) {
            throw new PropertyValidationException(
                Types.TYPE_ERROR,
                String.format("Value of '%s' must be of type %s", key, name())
            );
        }
        if (!(elementType instanceof ValidatingAttributeType)) {
            return;
        }
        List<Object> elements = PlainObjects.toList(value);
        for (int i = 0; i < elements.size(); i++) {
            ((ValidatingAttributeType) elementType).validate(key + "[" + i + "]", elements.get(i));
        }
    }
}
