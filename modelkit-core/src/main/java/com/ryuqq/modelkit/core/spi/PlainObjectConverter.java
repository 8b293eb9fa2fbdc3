package com.ryuqq.modelkit.core.spi;

import java.util.Map;

/**
 * Plain object normalization SPI.
 *
 * <p>Turns arbitrary input handed to deserialization into a detached
 * {@code Map<String, Object>} that the engine can read and restrict freely.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Never return the caller's map: plain input must be deep-copied</li>
 *   <li>{@code null} input converts to an empty map</li>
 *   <li>Unsupported input fails with {@link IllegalArgumentException}</li>
 * </ul>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public interface PlainObjectConverter {

    /**
     * Converts a value to a plain object.
     *
     * @param value the value to convert (may be null)
     * @return a new mutable plain object
     * @throws IllegalArgumentException if the value cannot be represented as a plain object
     */
    Map<String, Object> toPlainObject(Object value);
}
