package com.ryuqq.kindstore.core.query;

/**
 * 쿼리 정렬 조건.
 *
 * @param name wire 필드 이름
 * @param direction 정렬 방향
 * @author Kindstore Team
 * @since 1.0.0
 */
public record PropertyOrder(String name, Direction direction) {

    public PropertyOrder {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (direction == null) {
            throw new IllegalArgumentException("direction cannot be null");
        }
    }

    public static PropertyOrder asc(String name) {
        return new PropertyOrder(name, Direction.ASCENDING);
    }

    public static PropertyOrder desc(String name) {
        return new PropertyOrder(name, Direction.DESCENDING);
    }

    public boolean isDescending() {
        return direction == Direction.DESCENDING;
    }

    public enum Direction {
        ASCENDING,
        DESCENDING
    }

    @Override
    public String toString() {
        return isDescending() ? "-" + name : name;
    }
}
