package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.MsgpackCodec;

/**
 * msgpack으로 직렬화되는 속성.
 *
 * <p>ZonedDateTime, Key, Model은 extension 타입으로 저장됩니다 ({@link MsgpackCodec}).</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class MsgpackProperty extends SerializedProperty {

    private MsgpackProperty(Builder builder) {
        super(builder, new MsgpackCodec());
    }

    private MsgpackProperty(MsgpackProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public MsgpackProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new MsgpackProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder extends BlobProperty.Builder<MsgpackProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected MsgpackProperty create() {
            return new MsgpackProperty(this);
        }
    }
}
