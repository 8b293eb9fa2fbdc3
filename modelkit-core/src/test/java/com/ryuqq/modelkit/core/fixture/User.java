package com.ryuqq.modelkit.core.fixture;

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

public class User extends Model {

    public static final ModelType<User> TYPE = ModelType.define(User.class, User::new, b -> b
        .attribute("name", Types.STRING)
        .optionalAttribute("email", Types.STRING)
        .attribute("age", Types.INTEGER, 0)
        .attribute("role", Types.enumOf("member", "admin"), "member")
        .lazyAttribute("tags", Types.arrayOf(Types.STRING), ArrayList::new)
        .attribute("settings", Types.OBJECT, Map.of(
            "theme", "light",
            "notifications", Map.of("email", true, "sms", false)))
        .optionalAttribute("joinedAt", Types.DATE)
        .hasMany("posts", TargetRef.deferred(() -> Post.TYPE))
        .hasOne("profile", TargetRef.to(Profile.class))
        .validate("name", Rules.LENGTH, Map.of("min", 2, "max", 30))
        .validate("email", Rules.EMAIL)
        .validate("age", Rules.RANGE, Map.of("min", 0, "max", 150)));

    public User() {
        this(null, ConstructOptions.defaults());
    }

    public User(Map<String, ?> data) {
        this(data, ConstructOptions.defaults());
    }

    public User(Map<String, ?> data, ConstructOptions options) {
        super(data, options);
    }

    public String getName() {
        return get("name", String.class);
    }

    public Instant getJoinedAt() {
        return get("joinedAt", Instant.class);
    }

    @SuppressWarnings("unchecked")
    public List<Post> getPosts() {
        return (List<Post>) get("posts");
    }

    public Profile getProfile() {
        return get("profile", Profile.class);
    }
}
