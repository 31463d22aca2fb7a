package com.ryuqq.kindstore.core.query;

import java.util.Arrays;
import java.util.Objects;

/**
 * 쿼리의 단일 속성 필터.
 *
 * <p>값은 속성의 저장 표현(wire 값)으로 변환된 상태입니다.
 * 예: StringProperty 필터의 값은 인코딩된 {@code byte[]}.</p>
 *
 * @param name wire 필드 이름
 * @param operator 비교 연산자
 * @param value wire 값 (nullable)
 * @author Kindstore Team
 * @since 1.0.0
 */
public record PropertyFilter(String name, Operator operator, Object value) {

    public PropertyFilter {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (operator == null) {
            throw new IllegalArgumentException("operator cannot be null");
        }
    }

    /**
     * 비교 연산자.
     */
    public enum Operator {
        EQ("="),
        LT("<"),
        LE("<="),
        GT(">"),
        GE(">=");

        private final String symbol;

        Operator(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }

        /**
         * 비교 결과가 이 연산자를 만족하는지 확인.
         *
         * @param comparison {@code compare(stored, operand)}의 결과
         * @return 만족하면 true
         */
        public boolean matches(int comparison) {
            return switch (this) {
                case EQ -> comparison == 0;
                case LT -> comparison < 0;
                case LE -> comparison <= 0;
                case GT -> comparison > 0;
                case GE -> comparison >= 0;
            };
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PropertyFilter other)) return false;
        return name.equals(other.name) && operator == other.operator && Objects.deepEquals(value, other.value);
    }

    @Override
    public int hashCode() {
        int valueHash = value instanceof byte[] bytes ? Arrays.hashCode(bytes) : Objects.hashCode(value);
        return Objects.hash(name, operator, valueHash);
    }

    @Override
    public String toString() {
        String rendered = value instanceof byte[] bytes ? "b" + Arrays.toString(bytes) : String.valueOf(value);
        return name + " " + operator.symbol() + " " + rendered;
    }
}
