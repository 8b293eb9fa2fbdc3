package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.spi.ModelMetadata;

import java.util.List;
import java.util.Map;

/**
 * {@link ModelMetadata} backed by the {@link ModelType} registry.
 *
 * <p>Stateless; every lookup goes through {@link ModelType#of(Class)}.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public final class RegisteredModelMetadata implements ModelMetadata {

    private static final RegisteredModelMetadata INSTANCE = new RegisteredModelMetadata();

    private RegisteredModelMetadata() {
    }

    public static RegisteredModelMetadata getInstance() {
        return INSTANCE;
    }

    @Override
    public Map<String, AttributeDescriptor> getAttributes(Class<? extends Model> modelClass) {
        return ModelType.of(modelClass).descriptor().attributes();
    }

    @Override
    public Map<String, AssociationDescriptor> getAssociations(Class<? extends Model> modelClass) {
        return ModelType.of(modelClass).descriptor().associations();
    }

    @Override
    public List<ValidationDescriptor> getAttributeValidations(Class<? extends Model> modelClass, String attribute) {
        return ModelType.of(modelClass).descriptor().validations(attribute);
    }
}
