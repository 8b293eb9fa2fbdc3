package com.ryuqq.modelkit.testkit.fixture;

import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.metadata.TargetRef;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.type.Types;
import com.ryuqq.modelkit.core.validation.Rules;
import com.ryuqq.modelkit.testkit.contract.RecordingValidationRule;

import java.util.Map;

/**
 * Fixture model: a review of a {@link Book}.
 *
 * <p>{@link #RATING_AUDIT} is registered on {@code rating} so tests can observe
 * which values the validation engine hands to custom rules.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class Review extends Model {

    public static final RecordingValidationRule RATING_AUDIT = new RecordingValidationRule();

    public static final ModelType<Review> TYPE = ModelType.define(Review.class, Review::new, b -> b
        .attribute("rating", Types.INTEGER)
        .optionalAttribute("comment", Types.STRING)
        .belongsTo("book", TargetRef.deferred(() -> Book.TYPE))
        .validate("rating", Rules.RANGE, Map.of("min", 1, "max", 5))
        .validate("rating", RATING_AUDIT, Map.of("source", "fixture")));

    public Review(Map<String, ?> data) {
        this(data, ConstructOptions.defaults());
    }

    public Review(Map<String, ?> data, ConstructOptions options) {
        super(data, options);
    }

    public Integer getRating() {
        return get("rating", Integer.class);
    }

    public Book getBook() {
        return get("book", Book.class);
    }
}
