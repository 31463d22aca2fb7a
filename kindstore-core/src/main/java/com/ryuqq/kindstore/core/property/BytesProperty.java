package com.ryuqq.kindstore.core.property;

import java.util.List;

/**
 * 바이트 배열 속성. 인덱스할 수 없으며 선택적으로 압축됩니다.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class BytesProperty extends BlobProperty<byte[]> {

    private BytesProperty(Builder builder) {
        super(builder, byte[].class, List.of());
    }

    private BytesProperty(BytesProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public BytesProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new BytesProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder extends BlobProperty.Builder<BytesProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected BytesProperty create() {
            return new BytesProperty(this);
        }
    }
}
