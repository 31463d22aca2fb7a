package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.Property;

import java.util.List;

/**
 * 부동소수점 값 속성. 값은 {@link Double}로 저장되며 {@code Float}는 확장됩니다.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class FloatProperty extends Property<Double> {

    private FloatProperty(Builder builder) {
        super(builder, Double.class, List.of());
    }

    private FloatProperty(FloatProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public FloatProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new FloatProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    @Override
    protected Object validateElement(Object value) {
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        return super.validateElement(value);
    }

    public static final class Builder extends Property.Builder<FloatProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected FloatProperty create() {
            return new FloatProperty(this);
        }
    }
}
