/**
 * Validation package: error types, rules and the validation engine.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.validation.PropertyError} - One {kind, message} entry</li>
 *   <li>{@link com.ryuqq.modelkit.core.validation.ModelErrors} - Per-attribute error report</li>
 *   <li>{@link com.ryuqq.modelkit.core.validation.PropertyValidationException} - Thrown by types and rules</li>
 *   <li>{@link com.ryuqq.modelkit.core.validation.ModelValidationException} - Thrown once per failed validation, carries the report</li>
 * </ul>
 *
 * <h2>Engine</h2>
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.core.validation.ModelValidator} - Runs requiredness, type and custom checks</li>
 *   <li>{@link com.ryuqq.modelkit.core.validation.Rules} - Built-in length, range, pattern and email rules</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.core.validation;
