package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.Property;
import com.ryuqq.kindstore.core.query.PropertyFilter;

import java.util.List;

/**
 * Boolean 값 속성.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class BoolProperty extends Property<Boolean> {

    private BoolProperty(Builder builder) {
        super(builder, Boolean.class, List.of());
    }

    private BoolProperty(BoolProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public BoolProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new BoolProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return {@code name = true} 필터
     */
    public PropertyFilter isTrue() {
        return eq(Boolean.TRUE);
    }

    /**
     * @return {@code name = false} 필터
     */
    public PropertyFilter isFalse() {
        return eq(Boolean.FALSE);
    }

    public static final class Builder extends Property.Builder<BoolProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected BoolProperty create() {
            return new BoolProperty(this);
        }
    }
}
