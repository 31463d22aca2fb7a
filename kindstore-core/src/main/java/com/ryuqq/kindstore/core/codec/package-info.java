/**
 * Storage pipeline steps attached to properties.
 *
 * <p>A property stores a value by running it through its codecs first-to-last, and loads
 * it by running the wire value through them last-to-first.</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.kindstore.core.codec.TextEncodingCodec} - String ⇄ bytes</li>
 *   <li>{@link com.ryuqq.kindstore.core.codec.CompressionCodec} - zlib</li>
 *   <li>{@link com.ryuqq.kindstore.core.codec.JsonCodec} - Jackson</li>
 *   <li>{@link com.ryuqq.kindstore.core.codec.MsgpackCodec} - msgpack-core</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Kindstore Team
 */
package com.ryuqq.kindstore.core.codec;
