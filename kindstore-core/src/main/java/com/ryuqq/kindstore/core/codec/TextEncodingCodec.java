package com.ryuqq.kindstore.core.codec;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * String ⇄ byte[] 변환 단계.
 *
 * <p>디코딩 시 byte[]가 아닌 값(프로젝션 결과 등 이미 문자열인 값)은 그대로 통과시킵니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class TextEncodingCodec implements ValueCodec {

    private final Charset charset;

    public TextEncodingCodec() {
        this(StandardCharsets.UTF_8);
    }

    public TextEncodingCodec(Charset charset) {
        if (charset == null) {
            throw new IllegalArgumentException("charset cannot be null");
        }
        this.charset = charset;
    }

    @Override
    public Object encode(Object value) {
        if (!(value instanceof String text)) {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " cannot be encoded as text.");
        }
        return text.getBytes(charset);
    }

    @Override
    public Object decode(Object value) {
        if (value instanceof byte[] bytes) {
            return new String(bytes, charset);
        }
        return value;
    }

    public Charset charset() {
        return charset;
    }
}
