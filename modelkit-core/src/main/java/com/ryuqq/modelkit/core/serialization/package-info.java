/**
 * Serialization package: projection of model instances to plain objects and back.
 *
 * <h2>Engines</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.serialization.ModelSerializer} - Instance to plain object, depth-bounded association expansion</li>
 *   <li>{@link com.ryuqq.modelkit.core.serialization.ModelDeserializer} - Plain object to instance, date coercion, optional validation</li>
 * </ul>
 *
 * <h2>Options</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.serialization.SerializeOptions} - associations, depth</li>
 *   <li>{@link com.ryuqq.modelkit.core.serialization.DeserializeOptions} - validate, associations, depth</li>
 * </ul>
 *
 * <h2>Wire Format</h2>
 * <p>A {@code Map<String, Object>} whose keys are the attribute names plus, when expanded,
 * the association names. No envelope, version or schema metadata is embedded.</p>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.serialization;
