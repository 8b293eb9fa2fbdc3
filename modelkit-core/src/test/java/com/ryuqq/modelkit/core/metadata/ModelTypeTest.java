package com.ryuqq.modelkit.core.metadata;

import com.ryuqq.modelkit.core.fixture.Admin;
import com.ryuqq.modelkit.core.fixture.Profile;
import com.ryuqq.modelkit.core.fixture.User;
import com.ryuqq.modelkit.core.model.ConstructOptions;
import com.ryuqq.modelkit.core.model.Model;
import com.ryuqq.modelkit.core.type.Types;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModelType 레지스트리 테스트.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
class ModelTypeTest {

    static final class Unregistered extends Model {
        Unregistered() {
            super();
        }
    }

    static final class Duplicated extends Model {

        static final ModelType<Duplicated> TYPE = ModelType.define(Duplicated.class, Duplicated::new, b -> b
            .attribute("value", Types.STRING));

        Duplicated(Map<String, ?> data, ConstructOptions options) {
            super(data, options);
        }
    }

    @Test
    void of_RegisteredClass_ReturnsItsType() {
        // When & Then
        assertThat(ModelType.of(User.class)).isSameAs(User.TYPE);
        assertThat(User.TYPE.modelClass()).isEqualTo(User.class);
        assertThat(User.TYPE.name()).isEqualTo("User");
    }

    @Test
    void of_ClassNotYetInitialized_InitializesAndReturnsType() {
        // When
        ModelType<Profile> type = ModelType.of(Profile.class);

        // Then
        assertThat(type.descriptor().attributes()).containsOnlyKeys("bio", "website");
    }

    @Test
    void of_UnregisteredClass_ThrowsDefinitionException() {
        // When & Then
        assertThatThrownBy(() -> ModelType.of(Unregistered.class))
            .isInstanceOf(ModelDefinitionException.class)
            .hasMessageContaining("not defined");
        assertThat(ModelType.find(Unregistered.class)).isEmpty();
    }

    @Test
    void define_SameClassTwice_ThrowsException() {
        // Given
        assertThat(Duplicated.TYPE).isNotNull();

        // When & Then
        assertThatThrownBy(() -> ModelType.define(Duplicated.class, Duplicated::new, b -> b
            .attribute("other", Types.STRING)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("already defined");
        assertThat(ModelType.of(Duplicated.class).descriptor().attributes()).containsOnlyKeys("value");
    }

    @Test
    void define_NullFactory_ThrowsException() {
        // When & Then
        assertThatThrownBy(() -> ModelType.define(Unregistered.class, null, b -> { }))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("factory");
    }

    @Test
    void extend_InheritsParentDefinition() {
        // When
        ModelDescriptor descriptor = Admin.TYPE.descriptor();

        // Then
        assertThat(descriptor.attributes()).containsKeys("name", "email", "age", "role", "permissions");
        assertThat(descriptor.associations()).containsKeys("posts", "profile");
        assertThat(descriptor.attributes().get("role").resolveDefault()).isEqualTo("admin");
        assertThat(User.TYPE.descriptor().attributes()).doesNotContainKey("permissions");
        assertThat(Admin.TYPE.name()).isEqualTo("Admin");
    }

    @Test
    void create_UsesFactoryAndAppliesDefaults() {
        // When
        User user = User.TYPE.create(Map.of("name", "kim"));

        // Then
        assertThat(user.getName()).isEqualTo("kim");
        assertThat(user.get("role")).isEqualTo("member");
    }

    @Test
    void create_WithoutDefaults_SkipsDefaults() {
        // When
        User user = User.TYPE.create(Map.of("name", "kim"), ConstructOptions.withoutDefaults());

        // Then
        assertThat(user.fields()).containsOnlyKeys("name");
    }
}
