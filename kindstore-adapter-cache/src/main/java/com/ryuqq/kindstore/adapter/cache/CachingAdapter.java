package com.ryuqq.kindstore.adapter.cache;

import com.ryuqq.kindstore.core.codec.MsgpackCodec;
import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.query.Query;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.Cache;
import com.ryuqq.kindstore.core.spi.PutRequest;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import com.ryuqq.kindstore.core.spi.QueryResponse;
import com.ryuqq.kindstore.core.transaction.Propagation;
import com.ryuqq.kindstore.core.transaction.Transaction;
import com.ryuqq.kindstore.core.transaction.TransactionStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Supplier;

/**
 * 백엔드 어댑터 위에 강한 일관성의 캐시를 얹는 어댑터 (write-through invalidation).
 *
 * <p><strong>읽기 (get):</strong></p>
 * <ul>
 *   <li>트랜잭션 안에서는 캐시를 사용하지 않음</li>
 *   <li>캐시에 없거나 잠금 토큰이면 miss로 취급하여 백엔드에서 조회</li>
 *   <li>miss 키는 백엔드 조회 전에 자신의 토큰으로 예약({@code add})하고,
 *       조회 후 토큰이 그대로일 때만 CAS로 저장. 그 사이 쓰기가 토큰을 덮어썼거나
 *       키가 삭제되었으면 저장을 포기</li>
 * </ul>
 *
 * <p><strong>쓰기 (put / delete):</strong></p>
 * <ul>
 *   <li>트랜잭션 밖: 대상 키에 잠금 토큰을 설정(lockTimeout) → 백엔드 쓰기 → 성공/실패와 무관하게 키 삭제</li>
 *   <li>트랜잭션 안: 키를 바깥 트랜잭션에 모아두고 백엔드 커밋을 같은 방식으로 감쌈</li>
 *   <li>put의 partial Key는 캐시될 수 없으므로 무효화 대상에서 제외</li>
 * </ul>
 *
 * <p>쿼리는 캐시를 거치지 않고 백엔드에 위임합니다.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * Adapter adapter = new CachingAdapter(cache, new InMemoryAdapter(), new CachingAdapterConfig());
 * Adapters.set(adapter);
 * </pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class CachingAdapter implements Adapter {

    private static final Logger log = LoggerFactory.getLogger(CachingAdapter.class);

    private final Cache cache;
    private final Adapter backing;
    private final CachingAdapterConfig config;
    private final TransactionStack<CachingTransaction> transactions = new TransactionStack<>();

    public CachingAdapter(Cache cache, Adapter backing) {
        this(cache, backing, new CachingAdapterConfig());
    }

    public CachingAdapter(Cache cache, Adapter backing, CachingAdapterConfig config) {
        if (cache == null) {
            throw new IllegalArgumentException("cache cannot be null");
        }
        if (backing == null) {
            throw new IllegalArgumentException("backing adapter cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.cache = cache;
        this.backing = backing;
        this.config = config;
    }

    public Adapter backing() {
        return backing;
    }

    public CachingAdapterConfig config() {
        return config;
    }

    /**
     * Key의 캐시 키.
     *
     * @param key 엔티티 Key
     * @return {@code <namespace>:<sha256>}
     */
    public String cacheKey(Key key) {
        return CacheKeys.of(config.namespace(), key);
    }

    // ========== Get ==========

    @Override
    public List<Map<String, Object>> getMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (inTransaction()) {
            return backing.getMulti(keys);
        }

        List<String> cacheKeys = new ArrayList<>(keys.size());
        for (Key key : keys) {
            cacheKeys.add(cacheKey(key));
        }
        Map<String, byte[]> cached = cache.getMulti(new LinkedHashSet<>(cacheKeys));

        List<Map<String, Object>> results = new ArrayList<>(keys.size());
        Map<String, Key> missing = new LinkedHashMap<>();
        for (int i = 0; i < keys.size(); i++) {
            Map<String, Object> data = decode(cacheKeys.get(i), cached.get(cacheKeys.get(i)));
            results.add(data);
            if (data == null) {
                missing.put(cacheKeys.get(i), keys.get(i));
            }
        }
        log.debug("Cache lookup: {} hit(s), {} miss(es)", keys.size() - missing.size(), missing.size());
        if (missing.isEmpty()) {
            return results;
        }

        Map<String, byte[]> reservations = new LinkedHashMap<>();
        for (String cacheKey : missing.keySet()) {
            byte[] token = CacheKeys.newLockToken();
            if (cache.add(cacheKey, token, config.lockTimeout())) {
                reservations.put(cacheKey, token);
            }
        }

        List<Key> missingKeys = new ArrayList<>(missing.values());
        List<Map<String, Object>> fetched;
        try {
            fetched = backing.getMulti(missingKeys);
        } catch (RuntimeException | Error e) {
            releaseReservations(reservations);
            throw e;
        }
        Map<String, Map<String, Object>> fetchedByCacheKey = new LinkedHashMap<>();
        int index = 0;
        for (String cacheKey : missing.keySet()) {
            fetchedByCacheKey.put(cacheKey, fetched.get(index++));
        }

        for (int i = 0; i < keys.size(); i++) {
            if (results.get(i) == null) {
                results.set(i, fetchedByCacheKey.get(cacheKeys.get(i)));
            }
        }
        for (Map.Entry<String, byte[]> reservation : reservations.entrySet()) {
            populate(reservation.getKey(), reservation.getValue(), fetchedByCacheKey.get(reservation.getKey()));
        }
        return results;
    }

    /**
     * 백엔드 조회가 실패했을 때 자신이 건 예약 해제.
     *
     * <p>현재 값이 여전히 자신의 예약 토큰인 키만 삭제합니다.</p>
     */
    private void releaseReservations(Map<String, byte[]> reservations) {
        List<String> owned = new ArrayList<>(reservations.size());
        for (Map.Entry<String, byte[]> reservation : reservations.entrySet()) {
            Cache.CasValue current = cache.gets(reservation.getKey());
            if (current != null && Arrays.equals(current.value(), reservation.getValue())) {
                owned.add(reservation.getKey());
            }
        }
        if (!owned.isEmpty()) {
            cache.deleteMulti(owned);
        }
        log.debug("Released {} cache reservation(s) after failed backing read", owned.size());
    }

    private Map<String, Object> decode(String cacheKey, byte[] value) {
        if (value == null || CacheKeys.isLockToken(value)) {
            return null;
        }
        Object unpacked;
        try {
            unpacked = MsgpackCodec.unpack(value);
        } catch (IllegalArgumentException e) {
            log.warn("Discarding undecodable cache entry {}: {}", cacheKey, e.getMessage());
            return null;
        }
        if (!(unpacked instanceof Map<?, ?> map)) {
            log.warn("Discarding cache entry {} of unexpected type {}", cacheKey, unpacked);
            return null;
        }
        Map<String, Object> data = new LinkedHashMap<>();
        for (Map.Entry<?, ?> field : map.entrySet()) {
            data.put((String) field.getKey(), field.getValue());
        }
        return data;
    }

    /**
     * 예약한 키에 조회 결과 저장.
     *
     * <p>현재 값이 자신의 예약 토큰일 때만 그 CAS 토큰으로 저장합니다.</p>
     */
    private void populate(String cacheKey, byte[] reservation, Map<String, Object> data) {
        Cache.CasValue current = cache.gets(cacheKey);
        if (current == null) {
            log.debug("Cache reservation {} vanished before populate", cacheKey);
            return;
        }
        if (!Arrays.equals(current.value(), reservation)) {
            log.warn("Abandoning cache write for {}: reservation was taken over by a writer", cacheKey);
            return;
        }
        if (data == null) {
            cache.deleteMulti(List.of(cacheKey));
            return;
        }

        Cache.CasResult result = cache.cas(cacheKey, MsgpackCodec.pack(data), current.casToken(), config.itemTimeout());
        if (result != Cache.CasResult.STORED) {
            log.warn("Abandoning cache write for {}: compare-and-swap returned {}", cacheKey, result);
        }
    }

    // ========== Put / Delete ==========

    @Override
    public List<Key> putMulti(List<PutRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }

        List<Key> fullKeys = new ArrayList<>();
        for (PutRequest request : requests) {
            if (!request.key().isPartial()) {
                fullKeys.add(request.key());
            }
        }

        if (inTransaction()) {
            transactions.current().pushKeys(fullKeys);
            return backing.putMulti(requests);
        }
        return bust(fullKeys, () -> backing.putMulti(requests));
    }

    @Override
    public void deleteMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }

        if (inTransaction()) {
            transactions.current().pushKeys(keys);
            backing.deleteMulti(keys);
            return;
        }
        bust(keys, () -> {
            backing.deleteMulti(keys);
            return null;
        });
    }

    /**
     * 쓰기를 잠금/삭제로 감쌈.
     *
     * <p>쓰기 전에 모든 대상 키에 잠금 토큰을 설정하고, 쓰기가 끝나면 (실패하더라도) 키를 삭제합니다.</p>
     *
     * @param keys 쓰기 대상 Key
     * @param write 백엔드 쓰기
     * @param <T> 쓰기 결과 타입
     * @return 쓰기 결과
     */
    <T> T bust(Collection<Key> keys, Supplier<T> write) {
        if (keys.isEmpty()) {
            return write.get();
        }

        Set<String> cacheKeys = new LinkedHashSet<>();
        for (Key key : keys) {
            cacheKeys.add(cacheKey(key));
        }
        byte[] token = CacheKeys.newLockToken();
        Map<String, byte[]> locks = new LinkedHashMap<>();
        for (String cacheKey : cacheKeys) {
            locks.put(cacheKey, token);
        }

        cache.setMulti(locks, config.lockTimeout());
        try {
            return write.get();
        } finally {
            cache.deleteMulti(cacheKeys);
            log.debug("Busted {} cache key(s)", cacheKeys.size());
        }
    }

    // ========== Query ==========

    @Override
    public QueryResponse query(Query query, QueryOptions options) {
        return backing.query(query, options);
    }

    // ========== Transactions ==========

    @Override
    public Transaction transaction(Propagation propagation) {
        if (propagation == null) {
            throw new IllegalArgumentException("propagation cannot be null");
        }
        Transaction backingTransaction = backing.transaction(propagation);
        if (propagation == Propagation.NESTED && !transactions.isEmpty()) {
            CachingTransaction current = transactions.current();
            CachingOuterTransaction outer = current instanceof CachingInnerTransaction inner
                ? inner.outer()
                : (CachingOuterTransaction) current;
            return transactions.push(new CachingInnerTransaction(this, outer, backingTransaction));
        }
        return transactions.push(new CachingOuterTransaction(this, backingTransaction));
    }

    @Override
    public boolean inTransaction() {
        return !transactions.isEmpty();
    }

    @Override
    public Transaction currentTransaction() {
        return transactions.current();
    }

    void release(CachingTransaction transaction) {
        transactions.remove(transaction);
    }
}
