/**
 * Service Provider Interfaces consumed by the model engines.
 *
 * <h2>Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.spi.ModelMetadata} - Attribute, association and validation lookup</li>
 *   <li>{@link com.ryuqq.modelkit.core.spi.PlainObjectConverter} - Input normalization for deserialization</li>
 * </ul>
 *
 * <p>Default implementations live in the core module; adapters such as
 * {@code modelkit-adapter-jackson} provide alternatives.</p>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.spi;
