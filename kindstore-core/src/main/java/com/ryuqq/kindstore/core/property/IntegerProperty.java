package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.Property;

import java.util.List;

/**
 * 정수 값 속성. 값은 {@link Long}으로 저장되며 {@code Integer}, {@code Short}, {@code Byte}는 확장됩니다.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class IntegerProperty extends Property<Long> {

    private IntegerProperty(Builder builder) {
        super(builder, Long.class, List.of());
    }

    private IntegerProperty(IntegerProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public IntegerProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new IntegerProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    protected Object validateElement(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        return super.validateElement(value);
    }

    public static final class Builder extends Property.Builder<IntegerProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected IntegerProperty create() {
            return new IntegerProperty(this);
        }
    }
}
