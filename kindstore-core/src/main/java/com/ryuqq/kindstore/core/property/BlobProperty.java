package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.codec.CompressionCodec;
import com.ryuqq.kindstore.core.codec.ValueCodec;
import com.ryuqq.kindstore.core.model.Property;

import java.util.ArrayList;
import java.util.List;

/**
 * 인덱스할 수 없는 blob 속성의 기반 클래스.
 *
 * <p>선택적으로 저장 직전 값을 zlib 압축합니다 ({@link CompressionCodec}).
 * 압축은 항상 파이프라인의 마지막 단계입니다.</p>
 *
 * @param <T> 원소 값 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class BlobProperty<T> extends Property<T> {

    private final boolean compressed;

    protected BlobProperty(Builder<?, ?> builder, Class<T> valueType, List<ValueCodec> codecs) {
        super(builder, valueType, withCompression(builder, codecs));
        this.compressed = builder.compressed;
    }

    protected BlobProperty(BlobProperty<T> source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.compressed = source.compressed;
    }

    private static List<ValueCodec> withCompression(Builder<?, ?> builder, List<ValueCodec> codecs) {
        List<ValueCodec> pipeline = new ArrayList<>(codecs);
        if (builder.compressed) {
            pipeline.add(new CompressionCodec(builder.compressionLevel));
        }
        return pipeline;
    }

    public boolean isCompressed() {
        return compressed;
    }

    @Override
    protected final boolean isBlob() {
        return true;
    }

    /**
     * 압축 옵션을 가진 blob 빌더.
     */
    public abstract static class Builder<P extends BlobProperty<?>, B extends Builder<P, B>>
        extends Property.Builder<P, B> {

        private boolean compressed;
        private int compressionLevel = -1;

        protected Builder(String name) {
            super(name);
        }

        public B compressed() {
            this.compressed = true;
            return self();
        }

        /**
         * @param level zlib 압축 레벨 (-1 ~ 9)
         * @throws IllegalArgumentException 범위를 벗어난 경우
         */
        public B compressionLevel(int level) {
            if (level < -1 || level > 9) {
                throw new IllegalArgumentException("compression level must be an integer between -1 and 9 (current: " + level + ")");
            }
            this.compressionLevel = level;
            return self();
        }
    }
}
