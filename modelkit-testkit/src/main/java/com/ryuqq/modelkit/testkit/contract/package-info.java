/**
 * Contract test infrastructure.
 *
 * <ul>
 *   <li>{@link com.ryuqq.modelkit.testkit.contract.AbstractModelContractTest} - Base class with engine and helpers</li>
 *   <li>{@link com.ryuqq.modelkit.testkit.contract.RecordingValidationRule} - Rule that records its calls</li>
 * </ul>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.testkit.contract;
