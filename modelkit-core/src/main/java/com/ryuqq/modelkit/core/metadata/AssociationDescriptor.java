package com.ryuqq.modelkit.core.metadata;

/**
 * 모델 연관관계 정의.
 *
 * @param kind 연관관계 종류
 * @param target 대상 모델 참조
 *
 * @author ModelKit Team
 * @since 1.0.0
 */
public record AssociationDescriptor(
    AssociationKind kind,
    TargetRef target
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 target이 null인 경우
     */
    public AssociationDescriptor {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
    }

    public boolean isToMany() {
        return kind.isToMany();
    }
}
