/**
 * Jackson adapter.
 *
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.adapter.jackson.JacksonModelCodec} - Model to JSON text and back</li>
 *   <li>{@link com.ryuqq.modelkit.adapter.jackson.JacksonPlainObjectConverter} - Beans, records and JSON trees as deserialization input</li>
 *   <li>{@link com.ryuqq.modelkit.adapter.jackson.ModelCodecException} - Translated Jackson failures</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.adapter.jackson;
