/**
 * Model definition package: descriptor tables and the model type registry.
 *
 * <h2>Descriptors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.AttributeDescriptor} - Type, default value, optionality</li>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.AssociationDescriptor} - Relationship kind and target</li>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.ValidationDescriptor} - Custom rule and its options</li>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.ModelDescriptor} - The full table of one model type</li>
 * </ul>
 *
 * <h2>Lazy References</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.DefaultValue} - Constant or lazily computed default</li>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.TargetRef} - Direct or deferred association target</li>
 * </ul>
 *
 * <h2>Registry</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.ModelType} - Registered model type handle</li>
 *   <li>{@link com.ryuqq.modelkit.core.metadata.RegisteredModelMetadata} - Registry-backed metadata lookup</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.metadata;
