package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.TextEncodingCodec;
import com.ryuqq.kindstore.core.model.Property;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * 인덱스 가능한 문자열 속성.
 *
 * <p>값은 지정된 인코딩(기본 UTF-8)의 바이트로 저장됩니다.
 * 인덱스되는 값은 인코딩 후 {@value #MAX_INDEXED_LENGTH} 바이트를 넘을 수 없습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class StringProperty extends Property<String> {

    /**
     * 인덱스되는 문자열의 최대 길이 (인코딩된 바이트 수).
     */
    public static final int MAX_INDEXED_LENGTH = 1500;

    private final Charset charset;

    private StringProperty(Builder builder, Charset charset) {
        super(builder, String.class, List.of(new TextEncodingCodec(charset)));
        this.charset = charset;
    }

    private StringProperty(StringProperty source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.charset = source.charset;
    }

    @Override
    public StringProperty withPrefix(String entityPrefix, String modelPrefix) {
        return new StringProperty(this, entityPrefix, modelPrefix);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public Charset charset() {
        return charset;
    }

    @Override
    protected Object validateElement(Object value) {
        Object validated = super.validateElement(value);
        if (isIndexed()) {
            String text = (String) validated;
            if (text.getBytes(charset).length > MAX_INDEXED_LENGTH) {
                throw new IllegalArgumentException(
                    "String value is longer than the maximum allowed length (" + MAX_INDEXED_LENGTH
                        + ") for indexed properties. Set indexed to false if the value should not be indexed.");
            }
        }
        return validated;
    }

    public static final class Builder extends Property.Builder<StringProperty, Builder> {

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
        protected StringProperty create() {
            return new StringProperty(this, charset);
        }
    }
}
