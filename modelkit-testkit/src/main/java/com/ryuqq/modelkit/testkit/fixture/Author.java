package com.ryuqq.modelkit.testkit.fixture;

import com.ryuqq.modelkit.core.metadata.ModelType;
import com.ryuqq.modelkit.core.metadata.TargetRef;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.type.Types;
import com.ryuqq.modelkit.core.validation.Rules;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Fixture model: an author with many books.
 *
 * <p>{@code books} points at {@link Book}, which points back here through
 * {@code author}. Both sides use deferred targets.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public class Author extends Model {

    public static final ModelType<Author> TYPE = ModelType.define(Author.class, Author::new, b -> b
        .attribute("name", Types.STRING)
        .optionalAttribute("bornAt", Types.DATE)
        .lazyAttribute("genres", Types.arrayOf(Types.STRING), ArrayList::new)
        .hasMany("books", TargetRef.deferred(() -> Book.TYPE))
        .validate("name", Rules.LENGTH, Map.of("min", 1, "max", 100)));

    public Author() {
        this(null, ConstructOptions.defaults());
    }

    public Author(Map<String, ?> data) {
        this(data, ConstructOptions.defaults());
    }

    public Author(Map<String, ?> data, ConstructOptions options) {
        super(data, options);
    }

    public String getName() {
        return get("name", String.class);
    }

    public Instant getBornAt() {
        return get("bornAt", Instant.class);
    }

    @SuppressWarnings("unchecked")
    public List<Book> getBooks() {
        return (List<Book>) get("books");
    }
}
