package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.query.PropertyFilter;
import com.ryuqq.kindstore.core.query.PropertyOrder;
import com.ryuqq.kindstore.core.query.Query;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.PutRequest;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import com.ryuqq.kindstore.core.spi.QueryResponse;
import com.ryuqq.kindstore.core.transaction.AbstractTransaction;
import com.ryuqq.kindstore.core.transaction.Propagation;
import com.ryuqq.kindstore.core.transaction.Transaction;
import com.ryuqq.kindstore.core.transaction.TransactionFailedException;
import com.ryuqq.kindstore.core.transaction.TransactionStack;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Base64;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-memory implementation of {@link Adapter} SPI for testing and reference purposes.
 *
 * <p>원격 문서 저장소의 동작을 프로세스 안에서 재현합니다.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>entities:</strong> ConcurrentHashMap&lt;Key, StoredEntity&gt; - wire 데이터, 인덱스 제외 필드, 버전</li>
 *   <li><strong>ids:</strong> AtomicLong - partial Key에 할당할 순차 id</li>
 *   <li><strong>transactions:</strong> 스레드별 트랜잭션 스택</li>
 * </ul>
 *
 * <p><strong>Optimistic Transactions:</strong></p>
 * <ul>
 *   <li>트랜잭션 안의 get/put/delete는 Key를 처음 건드린 시점의 버전을 기록</li>
 *   <li>쓰기는 버퍼에 쌓이며 같은 Key는 마지막 쓰기가 남음</li>
 *   <li>커밋 시 저장소 락 아래에서 기록된 버전을 검증하고,
 *       달라졌으면 {@link TransactionFailedException}</li>
 *   <li>트랜잭션 안의 읽기는 커밋된 상태를 봄 (자신의 버퍼된 쓰기는 보이지 않음)</li>
 *   <li>쿼리는 트랜잭션에 참여하지 않음</li>
 * </ul>
 *
 * <p><strong>Queries:</strong></p>
 * <ul>
 *   <li>kind, namespace, ancestor(자기 자신 포함) 범위 지정</li>
 *   <li>필터: 리스트 값은 원소 중 하나라도 만족하면 일치, 인덱스 제외 필드는 일치하지 않음</li>
 *   <li>정렬: 기본 Key 순서, 정렬 필드가 없거나 인덱스 제외인 엔티티는 결과에서 제외</li>
 *   <li>커서: 결과 위치를 Base64로 인코딩한 값</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryAdapter adapter = Adapters.set(new InMemoryAdapter());
 * Person person = new Person();
 * person.set(Person.EMAIL, "john@example.com");
 * Entities.put(person);
 * </pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class InMemoryAdapter implements Adapter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryAdapter.class);

    private static final String CURSOR_PREFIX = "pos:";

    private final ConcurrentHashMap<Key, StoredEntity> entities = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final AtomicLong clock = new AtomicLong();
    private final Object commitLock = new Object();
    private final TransactionStack<AbstractTransaction> transactions = new TransactionStack<>();

    /**
     * 저장된 엔티티.
     *
     * @param key 완전한 Key
     * @param data wire 필드 이름 → wire 값
     * @param unindexed 인덱스 제외 필드 이름
     * @param version 저장소 전체에서 단조 증가하는 쓰기 버전 (삭제 후 재생성돼도 재사용되지 않음)
     */
    record StoredEntity(Key key, Map<String, Object> data, Set<String> unindexed, long version) {
    }

    // ========== Get / Put / Delete ==========

    @Override
    public List<Map<String, Object>> getMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }

        OuterTransaction transaction = currentOuter();
        List<Map<String, Object>> results = new ArrayList<>(keys.size());
        for (Key key : keys) {
            StoredEntity stored = entities.get(key);
            if (transaction != null) {
                transaction.touch(key, versionOf(stored));
            }
            results.add(stored == null ? null : copyData(stored.data()));
        }
        return results;
    }

    @Override
    public List<Key> putMulti(List<PutRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }

        OuterTransaction transaction = currentOuter();
        List<Key> keys = new ArrayList<>(requests.size());
        List<StoredEntity> writes = new ArrayList<>(requests.size());
        for (PutRequest request : requests) {
            Key key = request.key().isPartial() ? request.key().withId(ids.incrementAndGet()) : request.key();
            keys.add(key);
            writes.add(new StoredEntity(key, copyData(request.properties()),
                new LinkedHashSet<>(request.unindexed()), 0L));
        }

        if (transaction != null) {
            for (StoredEntity write : writes) {
                transaction.touch(write.key(), versionOf(entities.get(write.key())));
                transaction.write(write.key(), write);
            }
            return keys;
        }

        synchronized (commitLock) {
            for (StoredEntity write : writes) {
                apply(write.key(), write);
            }
        }
        return keys;
    }

    @Override
    public void deleteMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }

        OuterTransaction transaction = currentOuter();
        if (transaction != null) {
            for (Key key : keys) {
                transaction.touch(key, versionOf(entities.get(key)));
                transaction.write(key, null);
            }
            return;
        }

        synchronized (commitLock) {
            for (Key key : keys) {
                apply(key, null);
            }
        }
    }

    private void apply(Key key, StoredEntity write) {
        if (write == null) {
            entities.remove(key);
            return;
        }
        entities.put(key, new StoredEntity(key, write.data(), write.unindexed(), clock.incrementAndGet()));
    }

    private static long versionOf(StoredEntity stored) {
        return stored == null ? 0L : stored.version();
    }

    /**
     * 저장된 엔티티 수 (테스트용).
     *
     * @return 엔티티 수
     */
    public int size() {
        return entities.size();
    }

    /**
     * 모든 엔티티 삭제.
     */
    public void clear() {
        synchronized (commitLock) {
            entities.clear();
        }
    }

    // ========== Query ==========

    @Override
    public QueryResponse query(Query query, QueryOptions options) {
        if (query == null) {
            throw new IllegalArgumentException("query cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        List<StoredEntity> matches = new ArrayList<>();
        for (StoredEntity stored : entities.values()) {
            if (matchesScope(query, stored) && matchesFilters(query.filters(), stored)
                && hasSortFields(query.orders(), stored) && hasProjectedFields(query.projection(), stored)) {
                matches.add(stored);
            }
        }
        matches.sort(ordering(query.orders()));

        int start = decodeCursor(options.cursor()) + options.offset();
        int limit = options.limit() != null ? options.limit() : options.batchSize();
        int from = Math.min(start, matches.size());
        int to = Math.min(matches.size(), from + limit);

        List<QueryResponse.Entry> page = new ArrayList<>(to - from);
        for (StoredEntity stored : matches.subList(from, to)) {
            page.add(new QueryResponse.Entry(stored.key(),
                options.keysOnly() ? null : project(query.projection(), stored)));
        }
        log.debug("Query {} matched {} entit(y/ies), returning [{}, {})", query.kind(), matches.size(), from, to);
        return new QueryResponse(page, encodeCursor(to));
    }

    private static boolean matchesScope(Query query, StoredEntity stored) {
        Key key = stored.key();
        if (query.kind() != null && !query.kind().equals(key.getKind())) {
            return false;
        }
        if (!query.namespace().equals(key.getNamespace())) {
            return false;
        }
        if (query.ancestor() != null) {
            List<Object> ancestorPath = query.ancestor().path();
            List<Object> path = key.path();
            return query.ancestor().getNamespace().equals(key.getNamespace())
                && path.size() >= ancestorPath.size()
                && path.subList(0, ancestorPath.size()).equals(ancestorPath);
        }
        return true;
    }

    private static boolean matchesFilters(List<PropertyFilter> filters, StoredEntity stored) {
        for (PropertyFilter filter : filters) {
            if (stored.unindexed().contains(filter.name()) || !stored.data().containsKey(filter.name())) {
                return false;
            }
            Object value = stored.data().get(filter.name());
            if (value instanceof List<?> values) {
                boolean any = false;
                for (Object element : values) {
                    if (matches(filter, element)) {
                        any = true;
                        break;
                    }
                }
                if (!any) {
                    return false;
                }
            } else if (!matches(filter, value)) {
                return false;
            }
        }
        return true;
    }

    private static boolean matches(PropertyFilter filter, Object value) {
        if (!WireValueComparator.comparable(value, filter.value())) {
            return false;
        }
        return filter.operator().matches(WireValueComparator.INSTANCE.compare(value, filter.value()));
    }

    private static boolean hasSortFields(List<PropertyOrder> orders, StoredEntity stored) {
        for (PropertyOrder order : orders) {
            if (stored.unindexed().contains(order.name()) || !stored.data().containsKey(order.name())) {
                return false;
            }
        }
        return true;
    }

    private static boolean hasProjectedFields(List<String> projection, StoredEntity stored) {
        for (String field : projection) {
            if (stored.unindexed().contains(field) || !stored.data().containsKey(field)) {
                return false;
            }
        }
        return true;
    }

    private static Comparator<StoredEntity> ordering(List<PropertyOrder> orders) {
        Comparator<StoredEntity> comparator = (a, b) -> 0;
        for (PropertyOrder order : orders) {
            Comparator<StoredEntity> byField = (a, b) -> WireValueComparator.INSTANCE.compare(
                sortValue(a.data().get(order.name()), order.isDescending()),
                sortValue(b.data().get(order.name()), order.isDescending()));
            comparator = comparator.thenComparing(order.isDescending() ? byField.reversed() : byField);
        }
        return comparator.thenComparing((a, b) -> WireValueComparator.compareKeys(a.key(), b.key()));
    }

    private static Object sortValue(Object value, boolean descending) {
        if (!(value instanceof List<?> values) || values.isEmpty()) {
            return value;
        }
        Object selected = values.get(0);
        for (Object element : values) {
            int cmp = WireValueComparator.INSTANCE.compare(element, selected);
            if (descending ? cmp > 0 : cmp < 0) {
                selected = element;
            }
        }
        return selected;
    }

    private static Map<String, Object> project(List<String> projection, StoredEntity stored) {
        if (projection.isEmpty()) {
            return copyData(stored.data());
        }
        Map<String, Object> projected = new LinkedHashMap<>();
        for (String field : projection) {
            projected.put(field, copyValue(stored.data().get(field)));
        }
        return projected;
    }

    private static String encodeCursor(int position) {
        return Base64.getUrlEncoder().withoutPadding()
            .encodeToString((CURSOR_PREFIX + position).getBytes(StandardCharsets.UTF_8));
    }

    private static int decodeCursor(String cursor) {
        if (cursor == null) {
            return 0;
        }
        String decoded;
        try {
            decoded = new String(Base64.getUrlDecoder().decode(cursor), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
        if (!decoded.startsWith(CURSOR_PREFIX)) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor);
        }
        try {
            return Integer.parseInt(decoded.substring(CURSOR_PREFIX.length()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid cursor: " + cursor, e);
        }
    }

    // ========== Copying ==========

    private static Map<String, Object> copyData(Map<String, Object> data) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : data.entrySet()) {
            copy.put(field.getKey(), copyValue(field.getValue()));
        }
        return copy;
    }

    private static Object copyValue(Object value) {
        if (value instanceof List<?> values) {
            List<Object> copy = new ArrayList<>(values.size());
            for (Object element : values) {
                copy.add(copyValue(element));
            }
            return copy;
        }
        if (value instanceof byte[] bytes) {
            return Arrays.copyOf(bytes, bytes.length);
        }
        return value;
    }

    // ========== Transactions ==========

    @Override
    public Transaction transaction(Propagation propagation) {
        if (propagation == null) {
            throw new IllegalArgumentException("propagation cannot be null");
        }
        if (propagation == Propagation.NESTED && !transactions.isEmpty()) {
            return transactions.push(new InnerTransaction(outerOf(transactions.current())));
        }
        return transactions.push(new OuterTransaction());
    }

    @Override
    public boolean inTransaction() {
        return !transactions.isEmpty();
    }

    @Override
    public Transaction currentTransaction() {
        return transactions.current();
    }

    private OuterTransaction currentOuter() {
        return transactions.isEmpty() ? null : outerOf(transactions.current());
    }

    private static OuterTransaction outerOf(AbstractTransaction transaction) {
        return transaction instanceof InnerTransaction inner ? inner.outer : (OuterTransaction) transaction;
    }

    /**
     * 버전 검증과 쓰기 버퍼를 가진 독립 트랜잭션.
     */
    final class OuterTransaction extends AbstractTransaction {

        private final Map<Key, Long> versions = new HashMap<>();
        private final Map<Key, StoredEntity> writes = new LinkedHashMap<>();

        void touch(Key key, long version) {
            versions.putIfAbsent(key, version);
        }

        void write(Key key, StoredEntity entity) {
            writes.put(key, entity);
        }

        @Override
        protected void doBegin() {
            log.debug("Transaction begun (depth={})", transactions.depth());
        }

        @Override
        protected void doCommit() {
            synchronized (commitLock) {
                for (Map.Entry<Key, Long> touched : versions.entrySet()) {
                    long current = versionOf(entities.get(touched.getKey()));
                    if (current != touched.getValue()) {
                        throw new TransactionFailedException(
                            "Entity " + touched.getKey() + " was modified concurrently (expected version "
                                + touched.getValue() + ", found " + current + ").");
                    }
                }
                for (Map.Entry<Key, StoredEntity> write : writes.entrySet()) {
                    apply(write.getKey(), write.getValue());
                }
            }
            log.debug("Transaction committed ({} write(s))", writes.size());
        }

        @Override
        protected void doRollback() {
            writes.clear();
            versions.clear();
        }

        @Override
        protected void doEnd() {
            writes.clear();
            versions.clear();
            transactions.remove(this);
        }
    }

    /**
     * 바깥 트랜잭션에 합류하는 중첩 트랜잭션.
     *
     * <p>begin/commit은 아무 일도 하지 않고, rollback은 바깥 트랜잭션을 롤백합니다.</p>
     */
    final class InnerTransaction extends AbstractTransaction {

        private final OuterTransaction outer;

        InnerTransaction(OuterTransaction outer) {
            this.outer = outer;
        }

        @Override
        protected void doBegin() {
        }

        @Override
        protected void doCommit() {
        }

        @Override
        protected void doRollback() {
            outer.rollback();
        }

        @Override
        protected void doEnd() {
            transactions.remove(this);
        }
    }
}
