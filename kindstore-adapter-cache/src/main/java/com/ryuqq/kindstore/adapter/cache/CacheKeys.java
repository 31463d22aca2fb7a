package com.ryuqq.kindstore.adapter.cache;

import com.google.common.hash.Hashing;
import com.ryuqq.kindstore.core.key.Key;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.UUID;

/**
 * 캐시 키와 잠금 토큰.
 *
 * <p>캐시 키는 {@code <namespace>:<sha256(key.toString())>} 입니다.
 * 잠금 토큰은 {@link #LOCK_TAG}로 시작하는 값으로, 엔티티 데이터(msgpack map)와 구분됩니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
final class CacheKeys {

    /**
     * 잠금 토큰 접두사. msgpack map은 0x00으로 시작하지 않습니다.
     */
    static final byte[] LOCK_TAG = {0x00, 'k', 's', '-', 'l', 'o', 'c', 'k', ':'};

    private CacheKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static String of(String namespace, Key key) {
        String digest = Hashing.sha256().hashString(key.toString(), StandardCharsets.UTF_8).toString();
        return namespace + ":" + digest;
    }

    /**
     * 새 잠금 토큰 생성.
     *
     * @return 고유한 잠금 토큰
     */
    static byte[] newLockToken() {
        byte[] id = UUID.randomUUID().toString().getBytes(StandardCharsets.US_ASCII);
        byte[] token = Arrays.copyOf(LOCK_TAG, LOCK_TAG.length + id.length);
        System.arraycopy(id, 0, token, LOCK_TAG.length, id.length);
        return token;
    }

    static boolean isLockToken(byte[] value) {
        if (value == null || value.length < LOCK_TAG.length) {
            return false;
        }
        for (int i = 0; i < LOCK_TAG.length; i++) {
            if (value[i] != LOCK_TAG[i]) {
                return false;
            }
        }
        return true;
    }
}
