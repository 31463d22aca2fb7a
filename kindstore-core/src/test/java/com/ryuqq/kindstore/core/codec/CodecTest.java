package com.ryuqq.kindstore.core.codec;

import com.ryuqq.kindstore.core.fixture.Gadget;
import com.ryuqq.kindstore.core.key.Key;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ValueCodec 구현 테스트.
 */
class CodecTest {

    private static final ZonedDateTime INSTANT = ZonedDateTime.of(2024, 3, 1, 12, 30, 0, 123_456_000, ZoneOffset.UTC);

    @Nested
    @DisplayName("TextEncodingCodec")
    class TextEncoding {

        @Test
        @DisplayName("지정한 charset으로 인코딩한다")
        void encodesWithCharset() {
            TextEncodingCodec codec = new TextEncodingCodec(StandardCharsets.UTF_16BE);

            Object encoded = codec.encode("hi");

            assertThat(encoded).isEqualTo("hi".getBytes(StandardCharsets.UTF_16BE));
            assertThat(codec.decode(encoded)).isEqualTo("hi");
        }

        @Test
        @DisplayName("이미 문자열인 값은 그대로 디코딩한다")
        void decodePassesThroughStrings() {
            assertThat(new TextEncodingCodec().decode("plain")).isEqualTo("plain");
        }

        @Test
        @DisplayName("문자열이 아닌 값은 인코딩할 수 없다")
        void rejectsNonText() {
            assertThatThrownBy(() -> new TextEncodingCodec().encode(1L))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("CompressionCodec")
    class Compression {

        @Test
        @DisplayName("압축 후 해제하면 원래 바이트가 된다")
        void compressesAndInflates() {
            CompressionCodec codec = new CompressionCodec(9);
            byte[] input = "a".repeat(2000).getBytes(StandardCharsets.UTF_8);

            byte[] compressed = (byte[]) codec.encode(input);

            assertThat(compressed.length).isLessThan(input.length);
            assertThat(codec.decode(compressed)).isEqualTo(input);
        }

        @Test
        @DisplayName("압축 레벨은 -1에서 9 사이여야 한다")
        void validatesLevel() {
            assertThatThrownBy(() -> new CompressionCodec(10)).isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new CompressionCodec(-2)).isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("잘못된 압축 데이터는 IllegalArgumentException")
        void rejectsGarbage() {
            assertThatThrownBy(() -> new CompressionCodec(-1).decode(new byte[]{1, 2, 3}))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("JsonCodec")
    class Json {

        private final JsonCodec codec = new JsonCodec();

        @Test
        @DisplayName("기본 JSON 타입을 보존한다")
        void roundTripsPlainValues() {
            Map<String, Object> value = Map.of("n", 1L, "f", 1.5, "s", "text", "b", true, "l", List.of(1L, 2L));

            Object decoded = codec.decode(codec.encode(value));

            assertThat(decoded).isEqualTo(value);
        }

        @Test
        @DisplayName("날짜, Key, 바이트는 타입 태그로 보존된다")
        void roundTripsTaggedValues() {
            Key key = Key.of("Gadget", 5L);

            Map<?, ?> decoded = (Map<?, ?>) codec.decode(codec.encode(Map.of("at", INSTANT, "key", key, "raw", new byte[]{1, 2})));

            assertThat(decoded.get("at")).isEqualTo(INSTANT);
            assertThat(decoded.get("key")).isEqualTo(key);
            assertThat((byte[]) decoded.get("raw")).containsExactly(1, 2);
            assertThat((String) codec.encode(INSTANT)).contains(JsonCodec.TYPE_FIELD);
        }

        @Test
        @DisplayName("모델은 kind와 데이터로 저장되어 복원된다")
        void roundTripsModels() {
            Gadget gadget = Gadget.named("widget");
            gadget.setKey(Key.of("Gadget", 9L));

            Object decoded = codec.decode(codec.encode(gadget));

            assertThat(decoded).isInstanceOf(Gadget.class);
            assertThat(((Gadget) decoded).get(Gadget.NAME)).isEqualTo("widget");
            assertThat(((Gadget) decoded).getKey()).isEqualTo(gadget.getKey());
        }

        @Test
        @DisplayName("알 수 없는 타입 태그는 거부된다")
        void rejectsUnknownTag() {
            assertThatThrownBy(() -> codec.decode("{\"__type\":\"mystery\",\"value\":1}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mystery");
        }
    }

    @Nested
    @DisplayName("MsgpackCodec")
    class Msgpack {

        private final MsgpackCodec codec = new MsgpackCodec();

        @Test
        @DisplayName("날짜와 Key는 확장 타입으로 보존된다")
        void roundTripsExtensions() {
            Key key = Key.of("Gadget", "named", Key.of("Gadget", 1L));

            Object decoded = codec.decode(codec.encode(List.of(INSTANT, key, 3L, "s")));

            assertThat(decoded).isEqualTo(List.of(INSTANT, key, 3L, "s"));
        }

        @Test
        @DisplayName("잘못된 데이터는 IllegalArgumentException")
        void rejectsMalformedData() {
            assertThatThrownBy(() -> MsgpackCodec.unpack(new byte[]{(byte) 0xc1}))
                .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
