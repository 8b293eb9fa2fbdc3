package com.ryuqq.modelkit.testkit.contract;

import com.ryuqq.modelkit.core.serialization.DeserializeOptions;
import com.ryuqq.modelkit.core.serialization.SerializeOptions;
import com.ryuqq.modelkit.testkit.fixture.Author;
import com.ryuqq.modelkit.testkit.fixture.Book;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Cyclic graph contract.
 *
 * <p>author → books → author must terminate for every depth in both directions.</p>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
class CyclicGraphContractTest extends AbstractModelContractTest {

    @SuppressWarnings("unchecked")
    private static int nestingOf(Map<String, Object> plain) {
        int levels = 0;
        Object current = plain;
        while (current instanceof Map) {
            Map<String, Object> node = (Map<String, Object>) current;
            Object next = node.containsKey("books") ? node.get("books") : node.get("author");
            if (next instanceof List) {
                next = ((List<Object>) next).isEmpty() ? null : ((List<Object>) next).get(0);
            }
            if (next == null) {
                break;
            }
            levels++;
            current = next;
        }
        return levels;
    }

    @Test
    void serialize_CyclicGraph_NestingGrowsWithDepth() {
        // Given
        Author author = authorWithBooks("Kim", "First");

        // When & Then
        for (int depth = -1; depth <= 4; depth++) {
            Map<String, Object> plain = serializeNow(author, SerializeOptions.defaults().withDepth(depth));
            assertThat(nestingOf(plain)).as("nesting at depth %d", depth).isEqualTo(depth + 1);
        }
    }

    @Test
    void deserialize_SerializedCycle_RestoresBackReference() {
        // Given
        Author author = authorWithBooks("Kim", "First", "Second");
        Map<String, Object> plain = serializeNow(author, SerializeOptions.defaults().withDepth(2));

        // When
        Author restored = deserializeNow(Author.TYPE, plain, DeserializeOptions.defaults().withDepth(2));

        // Then
        assertThat(restored.getBooks()).extracting(Book::getTitle).containsExactly("First", "Second");
        Author backReference = restored.getBooks().get(0).getAuthor();
        assertThat(backReference.getName()).isEqualTo("Kim");
        assertThat(backReference).isNotSameAs(restored);
    }

    @Test
    void deserialize_CyclicMapGraph_StopsAtDepth() {
        // Given
        Map<String, Object> author = new LinkedHashMap<>();
        Map<String, Object> book = new LinkedHashMap<>();
        author.put("name", "Kim");
        author.put("genres", new ArrayList<>());
        author.put("books", List.of(book));
        book.put("title", "First");
        book.put("pages", 120);
        book.put("author", author);

        // When
        Author restored = deserializeNow(Author.TYPE, author, DeserializeOptions.defaults());

        // Then
        Book restoredBook = restored.getBooks().get(0);
        assertThat(restoredBook.getTitle()).isEqualTo("First");
        assertThat(restoredBook.getAuthor().getName()).isEqualTo("Kim");
        assertThat(restoredBook.getAuthor().has("books")).isFalse();
    }
}
