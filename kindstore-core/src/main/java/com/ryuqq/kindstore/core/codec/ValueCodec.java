package com.ryuqq.kindstore.core.codec;

/**
 * One step of a property's storage pipeline.
 *
 * <p>A property applies its codecs in declaration order when storing a value and in
 * reverse order when loading it. Repeated values are transformed element by element.
 * Codecs never see {@code null}.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public interface ValueCodec {

    /**
     * Transforms a model value (or the output of the previous step) towards its wire form.
     *
     * @param value non-null value
     * @return the encoded value
     * @throws IllegalArgumentException if the value cannot be encoded
     */
    Object encode(Object value);

    /**
     * Reverses {@link #encode(Object)}.
     *
     * @param value non-null wire value
     * @return the decoded value
     * @throws IllegalArgumentException if the value cannot be decoded
     */
    Object decode(Object value);
}
