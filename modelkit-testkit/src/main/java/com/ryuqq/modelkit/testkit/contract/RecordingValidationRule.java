package com.ryuqq.modelkit.testkit.contract;

import com.ryuqq.modelkit.core.validation.PropertyValidationException;
import com.ryuqq.modelkit.core.validation.ValidationRule;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * {@link ValidationRule} that records every invocation.
 *
 * <p>Optionally fails every call with a configured kind and message.
 * Thread-safe; invocations may arrive from any executor thread.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingValidationRule rule = new RecordingValidationRule();
 * rule.failWith("attribute.custom", "rejected");
 * // ... validate ...
 * assertEquals(1, rule.invocations().size());
 * rule.reset();
 * </pre>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class RecordingValidationRule implements ValidationRule {

    /**
     * One recorded call.
     *
     * @param key attribute name
     * @param value value handed to the rule
     * @param options rule options
     */
    public record Invocation(String key, Object value, Map<String, Object> options) {
    }

    private final List<Invocation> invocations = new CopyOnWriteArrayList<>();
    private volatile PropertyValidationException failure;

    @Override
    public void validate(String key, Object value, Map<String, Object> options) {
        invocations.add(new Invocation(key, value, options));
        PropertyValidationException configured = failure;
        if (configured != null) {
            throw new PropertyValidationException(configured.getKind(), configured.getMessage());
        }
    }

    /**
     * Makes every subsequent call fail.
     *
     * @param kind error kind to report
     * @param message error message to report
     */
    public void failWith(String kind, String message) {
        this.failure = new PropertyValidationException(kind, message);
    }

    /**
     * Returns the recorded calls in arrival order.
     *
     * @return a snapshot of the invocations
     */
    public List<Invocation> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Returns the values seen so far.
     *
     * @return recorded values, nulls included
     */
    public List<Object> values() {
        return invocations.stream().map(Invocation::value).collect(Collectors.toList());
    }

    /**
     * Clears recorded calls and any configured failure.
     */
    public void reset() {
        invocations.clear();
        failure = null;
    }
}
