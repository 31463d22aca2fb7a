package com.ryuqq.kindstore.core.condition;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.Property;

import java.util.Collection;
import java.util.Map;

/**
 * {@link com.ryuqq.kindstore.core.model.IndexCondition}으로 사용하는 조건부 인덱스 predicate.
 *
 * <pre>{@code
 * public static final BoolProperty PUBLISHED =
 *     BoolProperty.builder("published").indexedIf(Conditions::isTrue).build();
 * }</pre>
 *
 * <p>"empty"는 엔티티에 값이 명시적으로 설정되지 않은 상태를 뜻합니다 (기본값과 무관).</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Conditions {

    private Conditions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isDefault(Model entity, Property<?> property) {
        return Model.valuesEqual(entity.valueOf(property), property.defaultValue());
    }

    public static boolean isNotDefault(Model entity, Property<?> property) {
        return !isDefault(entity, property);
    }

    public static boolean isEmpty(Model entity, Property<?> property) {
        return !entity.has(property);
    }

    public static boolean isNotEmpty(Model entity, Property<?> property) {
        return entity.has(property);
    }

    public static boolean isNone(Model entity, Property<?> property) {
        return entity.has(property) && entity.valueOf(property) == null;
    }

    public static boolean isNotNone(Model entity, Property<?> property) {
        return entity.has(property) && entity.valueOf(property) != null;
    }

    public static boolean isTrue(Model entity, Property<?> property) {
        return entity.has(property) && truthy(entity.valueOf(property));
    }

    public static boolean isFalse(Model entity, Property<?> property) {
        return entity.has(property) && !truthy(entity.valueOf(property));
    }

    private static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number n) {
            return n.doubleValue() != 0;
        }
        if (value instanceof CharSequence s) {
            return s.length() > 0;
        }
        if (value instanceof Collection<?> c) {
            return !c.isEmpty();
        }
        if (value instanceof Map<?, ?> m) {
            return !m.isEmpty();
        }
        if (value instanceof byte[] bytes) {
            return bytes.length > 0;
        }
        return true;
    }
}
