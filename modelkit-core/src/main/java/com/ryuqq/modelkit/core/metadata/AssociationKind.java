package com.ryuqq.modelkit.core.metadata;

/**
 * 연관관계 종류.
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public enum AssociationKind {

    /**
     * 1:1 (소유).
     */
    HAS_ONE,

    /**
     * N:1 또는 1:1 (피소유).
     */
    BELONGS_TO_ONE,

    /**
     * 1:N.
     */
    HAS_MANY,

    /**
     * N:M.
     */
    MANY_TO_MANY;

    /**
     * 값이 컬렉션인 연관관계인지 확인.
     *
     * @return HAS_MANY 또는 MANY_TO_MANY인 경우 true
     */
    public boolean isToMany() {
        return this == HAS_MANY || this == MANY_TO_MANY;
    }
}
