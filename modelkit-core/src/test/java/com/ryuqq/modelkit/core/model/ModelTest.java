package com.ryuqq.modelkit.core.model;

import com.ryuqq.modelkit.core.fixture.Admin;
import com.ryuqq.modelkit.core.fixture.Post;
import com.ryuqq.modelkit.core.fixture.User;
import com.ryuqq.modelkit.core.metadata.ModelDefinitionException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Model 생성 및 필드 접근 테스트.
 *
 * <p>검증 항목:</p>
 * <ul>
 *   <li>고정 기본값, 지연 기본값 적용</li>
 *   <li>호출자 데이터 deep merge</li>
 *   <li>인스턴스 간 기본값 컨테이너 비공유</li>
 *   <li>상속 모델의 정의 조회</li>
 * </ul>
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
class ModelTest {

    static final class Undefined extends Model {
        Undefined() {
            super();
        }
    }

    // ============================================================
    // 1. 기본값
    // ============================================================

    @Test
    void construct_AppliesConstantAndLazyDefaults() {
        // When
        User user = new User();

        // Then
        assertThat(user.get("age")).isEqualTo(0);
        assertThat(user.get("role")).isEqualTo("member");
        assertThat(user.get("tags")).isEqualTo(List.of());
        assertThat(user.get("settings", Map.class)).containsEntry("theme", "light");
        assertThat(user.has("name")).isFalse();
        assertThat(user.has("email")).isFalse();
    }

    @SuppressWarnings("unchecked")
    @Test
    void construct_LazyDefault_IsFreshPerInstance() {
        // Given
        User first = new User();
        User second = new User();

        // When
        ((List<Object>) first.get("tags")).add("java");

        // Then
        assertThat(first.get("tags")).isNotSameAs(second.get("tags"));
        assertThat(second.get("tags")).isEqualTo(List.of());
    }

    @SuppressWarnings("unchecked")
    @Test
    void construct_ConstantMapDefault_IsNotSharedBetweenInstances() {
        // Given
        User first = new User();
        User second = new User();

        // When
        ((Map<String, Object>) first.get("settings")).put("theme", "dark");

        // Then
        assertThat(second.get("settings", Map.class)).containsEntry("theme", "light");
    }

    @Test
    void construct_WithoutDefaults_LeavesDefaultedAttributesUnset() {
        // When
        User user = new User(Map.of("name", "kim"), ConstructOptions.withoutDefaults());

        // Then
        assertThat(user.fields()).containsOnlyKeys("name");
    }

    // ============================================================
    // 2. Deep merge
    // ============================================================

    @Test
    void construct_CallerValuesWinOverDefaults() {
        // When
        User user = new User(Map.of("name", "kim", "role", "admin", "age", 30));

        // Then
        assertThat(user.getName()).isEqualTo("kim");
        assertThat(user.get("role")).isEqualTo("admin");
        assertThat(user.get("age")).isEqualTo(30);
    }

    @SuppressWarnings("unchecked")
    @Test
    void construct_NestedMapIsMergedIntoDefault() {
        // Given
        Map<String, Object> data = Map.of("settings", Map.of("notifications", Map.of("sms", true)));

        // When
        User user = new User(data);

        // Then
        Map<String, Object> settings = (Map<String, Object>) user.get("settings");
        assertThat(settings).containsEntry("theme", "light");
        assertThat((Map<String, Object>) settings.get("notifications"))
            .containsEntry("email", true)
            .containsEntry("sms", true);
    }

    @Test
    void construct_ExplicitNullOverwritesDefault() {
        // Given
        Map<String, Object> data = new HashMap<>();
        data.put("role", null);

        // When
        User user = new User(data);

        // Then
        assertThat(user.has("role")).isTrue();
        assertThat(user.get("role")).isNull();
        assertThat(user.get("age")).isEqualTo(0);
    }

    @SuppressWarnings("unchecked")
    @Test
    void construct_DoesNotAliasCallerData() {
        // Given
        List<Object> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("tags", tags);

        // When
        User user = new User(data);
        tags.add("b");

        // Then
        assertThat((List<Object>) user.get("tags")).containsExactly("a");
    }

    // ============================================================
    // 3. 필드 접근
    // ============================================================

    @Test
    void set_Get_Unset_Has() {
        // Given
        User user = new User();

        // When
        user.set("name", "lee").set("nickname", "l");

        // Then
        assertThat(user.get("name", String.class)).isEqualTo("lee");
        assertThat(user.has("nickname")).isTrue();
        assertThat(user.unset("nickname")).isEqualTo("l");
        assertThat(user.has("nickname")).isFalse();
    }

    @Test
    void set_NullValue_KeepsKey() {
        // Given
        User user = new User();

        // When
        user.set("email", null);

        // Then
        assertThat(user.has("email")).isTrue();
        assertThat(user.get("email")).isNull();
    }

    @Test
    void fields_IsReadOnlyView() {
        // Given
        User user = new User();

        // When & Then
        assertThatThrownBy(() -> user.fields().put("name", "x"))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toString_CyclicGraph_ListsKeysOnly() {
        // Given
        User user = new User(Map.of("name", "kim"));
        Post post = new Post(Map.of("title", "hello"));
        post.set("author", user);
        user.set("posts", List.of(post));

        // When
        String text = post.toString();

        // Then
        assertThat(text).startsWith("Post[").contains("title", "author");
    }

    @Test
    void get_WrongType_ThrowsClassCastException() {
        // Given
        User user = new User(Map.of("name", "kim"));

        // When & Then
        assertThatThrownBy(() -> user.get("name", Integer.class))
            .isInstanceOf(ClassCastException.class);
    }

    // ============================================================
    // 4. 상속 / 미정의 모델
    // ============================================================

    @Test
    void construct_Subclass_UsesMostDerivedDefinition() {
        // When
        User admin = new Admin(Map.of("name", "root"));

        // Then
        assertThat(admin.get("role")).isEqualTo("admin");
        assertThat(admin.get("permissions")).isEqualTo(List.of());
        assertThat(admin.get("settings", Map.class)).containsEntry("theme", "light");
    }

    @Test
    void construct_UndefinedModel_ThrowsDefinitionException() {
        // When & Then
        assertThatThrownBy(Undefined::new)
            .isInstanceOf(ModelDefinitionException.class)
            .hasMessageContaining(Undefined.class.getName());
    }

    @Test
    void construct_NullOptions_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> new User(Map.of(), null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
