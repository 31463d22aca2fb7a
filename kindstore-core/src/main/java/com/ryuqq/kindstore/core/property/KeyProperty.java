package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.model.Property;

import java.util.List;

/**
 * {@link Key} 값 속성.
 *
 * <p>모델 인스턴스를 할당하면 그 Key로 변환됩니다. partial Key는 허용되지 않으며,
 * kind가 지정되면 해당 kind의 Key만 허용됩니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class KeyProperty extends Property<Key> {

    private final String kind;

    private KeyProperty(Builder builder, String kind) {
        super(builder, Key.class, List.of());
        this.kind = kind;
    }

    private KeyProperty(KeyProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.kind = source.kind;
    }

    @Override
    public KeyProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new KeyProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * @return 허용되는 kind (null이면 제한 없음)
     */
    public String kind() {
        return kind;
    }

    @Override
    protected Object validateElement(Object value) {
        Object candidate = value instanceof Model model ? model.getKey() : value;
        Key key = (Key) super.validateElement(candidate);
        if (key.isPartial()) {
            throw new IllegalArgumentException("Cannot assign partial Keys to Key properties.");
        }
        if (kind != null && !kind.equals(key.getKind())) {
            throw new IllegalArgumentException(
                "Property " + nameOnModel() + " cannot be assigned keys of kind " + key.getKind() + ".");
        }
        return key;
    }

    public static final class Builder extends Property.Builder<KeyProperty, Builder> {

        private String kind;

        private Builder(String name) {
            super(name);
        }

        public Builder kind(String kind) {
            this.kind = kind;
            return this;
        }

        public Builder kind(ModelSchema<?> schema) {
            if (schema == null) {
                throw new IllegalArgumentException("schema cannot be null");
            }
            this.kind = schema.kind();
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected KeyProperty create() {
            return new KeyProperty(this, kind);
        }
    }
}
