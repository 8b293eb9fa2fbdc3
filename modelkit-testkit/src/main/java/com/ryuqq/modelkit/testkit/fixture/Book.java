package com.ryuqq.modelkit.testkit.fixture;

import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.metadata.TargetRef;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.type.Types;
import com.ryuqq.modelkit.core.validation.Rules;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Fixture model: a book written by an {@link Author}, with many {@link Review}s.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class Book extends Model {

    public static final String ISBN_REGEX = "\\d{3}-\\d{10}";

    public static final ModelType<Book> TYPE = ModelType.define(Book.class, Book::new, b -> b
        .attribute("title", Types.STRING)
        .optionalAttribute("isbn", Types.STRING)
        .attribute("pages", Types.INTEGER, 0)
        .optionalAttribute("publishedAt", Types.DATE)
        .belongsTo("author", TargetRef.deferred(() -> Author.TYPE))
        .hasMany("reviews", TargetRef.deferred(() -> Review.TYPE))
        .validate("isbn", Rules.PATTERN, Map.of("regex", ISBN_REGEX))
        .validate("pages", Rules.RANGE, Map.of("min", 0)));

    public Book(Map<String, ?> data) {
        this(data, ConstructOptions.defaults());
    }

    public Book(Map<String, ?> data, ConstructOptions options) {
        super(data, options);
    }

    public String getTitle() {
        return get("title", String.class);
    }

    public Instant getPublishedAt() {
        return get("publishedAt", Instant.class);
    }

    public Author getAuthor() {
        return get("author", Author.class);
    }

    @SuppressWarnings("unchecked")
    public List<Review> getReviews() {
        return (List<Review>) get("reviews");
    }
}
