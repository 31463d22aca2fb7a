package com.ryuqq.kindstore.core.codec;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * zlib 압축 단계.
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>level: -1(기본) ~ 9, 범위를 벗어나면 생성 시점에 실패</li>
 *   <li>String 입력은 UTF-8로 인코딩 후 압축 (직렬화 단계의 출력이 문자열인 경우)</li>
 *   <li>디코딩 결과는 항상 byte[]</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class CompressionCodec implements ValueCodec {

    private static final int BUFFER_SIZE = 4096;

    private final int level;

    /**
     * @param level 압축 레벨 (-1 ~ 9)
     * @throws IllegalArgumentException 범위를 벗어난 경우
     */
    public CompressionCodec(int level) {
        if (level < -1 || level > 9) {
            throw new IllegalArgumentException("compression level must be an integer between -1 and 9 (current: " + level + ")");
        }
        this.level = level;
    }

    @Override
    public Object encode(Object value) {
        byte[] input = toBytes(value);
        Deflater deflater = new Deflater(level);
        try {
            deflater.setInput(input);
            deflater.finish();
            ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!deflater.finished()) {
                int n = deflater.deflate(buffer);
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } finally {
            deflater.end();
        }
    }

    @Override
    public Object decode(Object value) {
        byte[] input = toBytes(value);
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(input);
            ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 2);
            byte[] buffer = new byte[BUFFER_SIZE];
            while (!inflater.finished()) {
                int n = inflater.inflate(buffer);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    throw new IllegalArgumentException("Truncated compressed value.");
                }
                out.write(buffer, 0, n);
            }
            return out.toByteArray();
        } catch (DataFormatException e) {
            throw new IllegalArgumentException("Invalid compressed value.", e);
        } finally {
            inflater.end();
        }
    }

    private static byte[] toBytes(Object value) {
        if (value instanceof byte[] bytes) {
            return bytes;
        }
        if (value instanceof String text) {
            return text.getBytes(StandardCharsets.UTF_8);
        }
        throw new IllegalArgumentException(
            "Value of type " + value.getClass().getSimpleName() + " cannot be compressed.");
    }

    public int level() {
        return level;
    }
}
