package com.ryuqq.modelkit.core.spi;

import com.ryuqq.modelkit.core.metadata.AssociationDescriptor;
import com.ryuqq.modelkit.core.metadata.AttributeDescriptor;
import com.ryuqq.modelkit.core.metadata.ValidationDescriptor;
import com.ryuqq.modelkit.core.model.Model;

import java.util.List;
import java.util.Map;

/**
 * Model metadata lookup SPI.
 *
 * <p>Provides the attribute, association and validation descriptors of a model type.
 * The validation, serialization and deserialization engines read model shapes
 * exclusively through this interface.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Read-only: returned maps and lists must not change after the model type is defined</li>
 *   <li>Ordered: entries are returned in declaration order</li>
 *   <li>Thread-safe: all methods must be safely callable from multiple threads</li>
 *   <li>Most-derived lookup: callers always pass the runtime class of an instance</li>
 * </ul>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public interface ModelMetadata {

    /**
     * Returns the attributes declared for a model type.
     *
     * @param modelClass the model class
     * @return attribute name to descriptor, in declaration order
     * @throws com.ryuqq.modelkit.core.metadata.ModelDefinitionException if the class is not a defined model type
     */
    Map<String, AttributeDescriptor> getAttributes(Class<? extends Model> modelClass);

    /**
     * Returns the associations declared for a model type.
     *
     * @param modelClass the model class
     * @return association name to descriptor, in declaration order (may be empty)
     * @throws com.ryuqq.modelkit.core.metadata.ModelDefinitionException if the class is not a defined model type
     */
    Map<String, AssociationDescriptor> getAssociations(Class<? extends Model> modelClass);

    /**
     * Returns the custom validation rules registered against one attribute.
     *
     * @param modelClass the model class
     * @param attribute the attribute name
     * @return rules in registration order (may be empty)
     * @throws com.ryuqq.modelkit.core.metadata.ModelDefinitionException if the class is not a defined model type
     */
    List<ValidationDescriptor> getAttributeValidations(Class<? extends Model> modelClass, String attribute);
}
