package com.ryuqq.modelkit.core.model;

import com.ryuqq.modelkit.core.fixture.Post;
import com.ryuqq.modelkit.core.fixture.User;
import com.ryuqq.modelkit.core.metadata.RegisteredModelMetadata;
import com.ryuqq.modelkit.core.serialization.DeserializeOptions;
import com.ryuqq.modelkit.core.serialization.SerializeOptions;
import com.ryuqq.modelkit.core.spi.PlainObjectConverter;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * ModelEngine 구성 테스트.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ModelEngineTest {

    @Mock
    private PlainObjectConverter converter;

    @Test
    void defaults_UsesRegistryMetadata() {
        // When
        ModelEngine engine = ModelEngine.defaults();

        // Then
        assertThat(engine.metadata()).isSameAs(RegisteredModelMetadata.getInstance());
        assertThat(engine).isSameAs(ModelEngine.defaults());
    }

    @Test
    void builder_NullDependencies_ThrowException() {
        // When & Then
        assertThatThrownBy(() -> ModelEngine.builder().metadata(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelEngine.builder().converter(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ModelEngine.builder().executor(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void deserialize_UsesConfiguredConverter() {
        // Given
        Object foreign = new Object();
        when(converter.toPlainObject(foreign)).thenReturn(Map.of("title", "converted"));
        ModelEngine engine = ModelEngine.builder().converter(converter).build();

        // When
        Post post = engine.deserialize(Post.TYPE, foreign, DeserializeOptions.defaults()).join();

        // Then
        assertThat(post.getTitle()).isEqualTo("converted");
        verify(converter).toPlainObject(foreign);
    }

    @Test
    void serialize_CustomExecutor_RunsAssociationsThere() {
        // Given
        AtomicInteger submitted = new AtomicInteger();
        ModelEngine engine = ModelEngine.builder()
            .executor(task -> {
                submitted.incrementAndGet();
                task.run();
            })
            .build();
        User user = new User(Map.of("name", "kim"));
        user.set("posts", List.of(new Post(Map.of("title", "a")), new Post(Map.of("title", "b"))));

        // When
        Map<String, Object> output = engine.serialize(user, SerializeOptions.defaults()).join();

        // Then
        assertThat(submitted.get()).isEqualTo(2);
        assertThat((List<?>) output.get("posts")).hasSize(2);
    }

    @SuppressWarnings("unchecked")
    @Test
    void serialize_ThreadPoolExecutor_PreservesElementOrder() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            ModelEngine engine = ModelEngine.builder().executor(pool).build();
            User user = new User(Map.of("name", "kim"));
            List<Post> posts = new java.util.ArrayList<>();
            for (int i = 0; i < 50; i++) {
                posts.add(new Post(Map.of("title", "post-" + i)));
            }
            user.set("posts", posts);

            // When
            Map<String, Object> output = engine.serialize(user).get();

            // Then
            List<Map<String, Object>> serialized = (List<Map<String, Object>>) output.get("posts");
            assertThat(serialized).hasSize(50);
            for (int i = 0; i < 50; i++) {
                assertThat(serialized.get(i)).containsEntry("title", "post-" + i);
            }
        } finally {
            pool.shutdownNow();
        }
    }
}
