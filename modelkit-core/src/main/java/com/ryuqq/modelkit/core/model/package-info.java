/**
 * Model package: the base type every model extends and the engine facade.
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.model.Model} - Base class with a per-instance field store</li>
 *   <li>{@link com.ryuqq.modelkit.core.model.ConstructOptions} - Whether defaults are applied on construction</li>
 *   <li>{@link com.ryuqq.modelkit.core.model.ModelEngine} - Validator, serializer and deserializer wired together</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Storage-agnostic:</strong> no identity, no persistence, no query API</li>
 *   <li><strong>Explicit metadata:</strong> descriptor tables instead of reflection or annotations</li>
 *   <li><strong>Asynchronous:</strong> every engine operation returns a CompletableFuture</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.model;
