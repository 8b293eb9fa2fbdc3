/**
 * Internal helpers shared by the engines.
 *
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.support.PlainObjects} - Deep merge, deep copy, key restriction, sequence handling</li>
 *   <li>{@link com.ryuqq.modelkit.core.support.Futures} - Fan-out and ordered join of CompletableFutures</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.support;
