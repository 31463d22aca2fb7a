package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.TextEncodingCodec;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 긴 문자열 속성. 인덱스할 수 없으며 인코딩 후 선택적으로 압축됩니다.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class TextProperty extends BlobProperty<String> {

    private TextProperty(Builder builder, Charset charset) {
        super(builder, String.class, List.of(new TextEncodingCodec(charset)));
    }

    private TextProperty(TextProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
    }

    @Override
    public TextProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new TextProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder extends BlobProperty.Builder<TextProperty, Builder> {

        private Charset charset = StandardCharsets.UTF_8;

        private Builder(String name) {
            super(name);
        }

        public Builder encoding(Charset charset) {
            if (charset == null) {
                throw new IllegalArgumentException("charset cannot be null");
            }
            this.charset = charset;
            return this;
        }

        @Override
        protected Builder self() {
            return this;
        }

        @Override
        protected TextProperty create() {
            return new TextProperty(this, charset);
        }
    }
}
