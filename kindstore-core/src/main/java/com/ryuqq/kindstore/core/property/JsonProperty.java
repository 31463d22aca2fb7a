package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.JsonCodec;

/**
 * JSON으로 직렬화되는 속성 (Jackson).
 *
 * <p>JSON 표준 타입이 아닌 값(byte[], ZonedDateTime, Key, Model)은
 * {@link JsonCodec#TYPE_FIELD} 태그가 붙은 객체로 저장됩니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class JsonProperty extends SerializedProperty {

    private JsonProperty(Builder builder) {
        super(builder, new JsonCodec());
    }

    private JsonProperty(JsonProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public JsonProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new JsonProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder extends BlobProperty.Builder<JsonProperty, Builder> {

        private Builder(String name) {
            super(name);
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected JsonProperty create() {
            return new JsonProperty(this);
        }
    }
}
