/**
 * Attribute type package.
 *
 * <h2>Capabilities</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.type.AttributeType} - Named semantic type</li>
 *   <li>{@link com.ryuqq.modelkit.core.type.ValidatingAttributeType} - Type that can reject values</li>
 *   <li>{@link com.ryuqq.modelkit.core.type.DateAttributeType} - Type whose text values are parsed on deserialization</li>
 * </ul>
 *
 * <h2>Built-ins</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.type.Types} - string, number, integer, boolean, date, object, array, any, enum</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.type;
