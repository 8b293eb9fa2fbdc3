/**
 * Fixture models shared by contract tests.
 *
 * <p>{@link com.ryuqq.modelkit.testkit.fixture.Author} has many
 * {@link com.ryuqq.modelkit.testkit.fixture.Book}s, a book has many
 * {@link com.ryuqq.modelkit.testkit.fixture.Review}s, and each child points back
 * to its parent, so every graph built from them can be cyclic.</p>
 *
 * @since 1.0.0
 * @author ModelKit Team
 */
package com.ryuqq.modelkit.testkit.fixture;
