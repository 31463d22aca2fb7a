package com.ryuqq.kindstore.adapter.cache;

import com.ryuqq.kindstore.core.codec.MsgpackCodec;
import com.ryuqq.kindstore.core.key.Key;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CacheKeysTest {

    @Test
    @DisplayName("캐시 키는 namespace와 Key의 SHA-256 hex로 구성된다")
    void cacheKeyFormat() {
        String cacheKey = CacheKeys.of("kindstore", Key.of("Person", 1L));

        assertThat(cacheKey).matches("kindstore:[0-9a-f]{64}");
        assertThat(cacheKey).isEqualTo(CacheKeys.of("kindstore", Key.of("Person", 1L)));
        assertThat(cacheKey).isNotEqualTo(CacheKeys.of("kindstore", Key.of("Person", 2L)));
    }

    @Test
    @DisplayName("잠금 토큰은 매번 다르고 엔티티 데이터와 구분된다")
    void lockTokens() {
        byte[] first = CacheKeys.newLockToken();
        byte[] second = CacheKeys.newLockToken();

        assertThat(first).isNotEqualTo(second);
        assertThat(CacheKeys.isLockToken(first)).isTrue();
        assertThat(CacheKeys.isLockToken(MsgpackCodec.pack(Map.of("n", 1L)))).isFalse();
        assertThat(CacheKeys.isLockToken(new byte[0])).isFalse();
    }
}
