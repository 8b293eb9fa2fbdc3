package com.ryuqq.modelkit.core.validation;

import com.ryuqq.modelkit.core.fixture.Profile;
import com.ryuqq.modelkit.core.metadata.AttributeDescriptor;
import com.ryuqq.modelkit.core.metadata.DefaultValue;
import com.ryuqq.modelkit.core.metadata.ValidationDescriptor;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.ModelEngine;
import com.ryuqq.modelkit.core.spi.ModelMetadata;
import com.ryuqq.modelkit.core.type.Types;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import static com.ryuqq.modelkit.core.fixture.FutureAssertions.failureOf;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

/**
 * ModelValidator 규칙 실행 테스트.
 *
 * <p>메타데이터를 mock으로 대체하여 규칙 호출 인자와 오류 변환을 검증합니다.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ModelValidatorRuleTest {

    @Mock
    private ModelMetadata metadata;

    @Mock
    private ValidationRule rule;

    @Mock
    private ValidationRule otherRule;

    private ModelValidator validator;
    private Profile profile;

    @BeforeEach
    void setUp() {
        validator = new ModelValidator(metadata, ModelEngine.DIRECT_EXECUTOR);
        profile = new Profile(Map.of(), ConstructOptions.withoutDefaults());
    }

    private void givenScore(AttributeDescriptor descriptor, ValidationDescriptor... validations) {
        when(metadata.getAttributes(Profile.class)).thenReturn(Map.of("score", descriptor));
        when(metadata.getAttributeValidations(Profile.class, "score")).thenReturn(List.of(validations));
    }

    @Test
    void collectErrors_RequiredFalse_PassesDefaultToRules() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.NUMBER, DefaultValue.of(5), false),
            new ValidationDescriptor(rule, Map.of("flag", true)));

        // When
        ModelErrors errors = validator.collectErrors(profile, ValidateOptions.defaults().withRequired(false));

        // Then
        assertThat(errors.isEmpty()).isTrue();
        verify(rule).validate("score", 5, Map.of("flag", true));
    }

    @Test
    void collectErrors_RequiredMissing_StillRunsRulesWithNull() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.NUMBER, null, false),
            new ValidationDescriptor(rule, null));

        // When
        ModelErrors errors = validator.collectErrors(profile, ValidateOptions.defaults());

        // Then
        assertThat(errors.get("score")).containsExactly(PropertyError.required());
        verify(rule).validate(eq("score"), isNull(), anyMap());
    }

    @Test
    void collectErrors_OptionalMissing_SkipsRules() throws Exception {
        // Given
        when(metadata.getAttributes(Profile.class))
            .thenReturn(Map.of("score", new AttributeDescriptor(Types.NUMBER, null, true)));

        // When
        ModelErrors errors = validator.collectErrors(profile, ValidateOptions.defaults());

        // Then
        assertThat(errors.isEmpty()).isTrue();
        verify(metadata, never()).getAttributeValidations(any(), any());
        verifyNoInteractions(rule);
    }

    @Test
    void collectErrors_EveryRuleRunsAndForeignErrorsBecomeUnknown() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.NUMBER, null, false),
            new ValidationDescriptor(rule, null),
            new ValidationDescriptor(otherRule, null));
        doThrow(new IllegalStateException("boom")).when(rule).validate(any(), any(), any());
        doThrow(new PropertyValidationException("attribute.custom", "custom failure"))
            .when(otherRule).validate(any(), any(), any());
        profile.set("score", "high");

        // When
        ModelErrors errors = validator.collectErrors(profile, ValidateOptions.defaults());

        // Then
        assertThat(errors.get("score")).containsExactly(
            PropertyError.of(Types.TYPE_ERROR, "Value of 'score' must be of type number"),
            PropertyError.of(PropertyError.UNKNOWN, "boom"),
            PropertyError.of("attribute.custom", "custom failure"));
    }

    @Test
    void validate_CheckedExceptionFromRule_IsReported() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.ANY, null, false),
            new ValidationDescriptor(rule, null));
        doThrow(new IOException("lookup failed")).when(rule).validate(any(), any(), any());
        profile.set("score", 1);

        // When
        ModelValidationException failure = failureOf(validator.validate(profile), ModelValidationException.class);

        // Then
        assertThat(failure.getModelType()).isEqualTo(Profile.class);
        assertThat(failure.getErrors().get("score")).containsExactly(PropertyError.of("unknown", "lookup failed"));
    }

    @Test
    void collectErrors_AssertionErrorFromRule_BecomesUnknownAndOtherRulesRun() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.ANY, null, false),
            new ValidationDescriptor(rule, null),
            new ValidationDescriptor(otherRule, null));
        doThrow(new AssertionError("score must be positive")).when(rule).validate(any(), any(), any());
        profile.set("score", -1);

        // When
        ModelErrors errors = validator.collectErrors(profile, ValidateOptions.defaults());

        // Then
        assertThat(errors.get("score"))
            .containsExactly(PropertyError.of(PropertyError.UNKNOWN, "score must be positive"));
        verify(otherRule).validate("score", -1, Map.of());
    }

    @Test
    void collectErrors_OtherErrorFromRule_Propagates() throws Exception {
        // Given
        givenScore(
            new AttributeDescriptor(Types.ANY, null, false),
            new ValidationDescriptor(rule, null));
        doThrow(new OutOfMemoryError("heap")).when(rule).validate(any(), any(), any());
        profile.set("score", 1);

        // When & Then
        assertThatThrownBy(() -> validator.collectErrors(profile, ValidateOptions.defaults()))
            .isInstanceOf(OutOfMemoryError.class);
    }
}
