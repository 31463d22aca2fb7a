package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.query.PropertyFilter;
import com.ryuqq.kindstore.core.query.Query;
import com.ryuqq.kindstore.core.spi.PutRequest;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import com.ryuqq.kindstore.core.spi.QueryResponse;
import com.ryuqq.kindstore.core.transaction.Propagation;
import com.ryuqq.kindstore.core.transaction.Transaction;
import com.ryuqq.kindstore.core.transaction.TransactionFailedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryAdapter 단위 테스트 (SPI 수준).
 */
class InMemoryAdapterTest {

    private InMemoryAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new InMemoryAdapter();
    }

    private Key put(Key key, List<String> unindexed, Map<String, Object> data) {
        return adapter.putMulti(List.of(new PutRequest(key, unindexed, data))).get(0);
    }

    private static Map<String, Object> data(Object... pairs) {
        Map<String, Object> data = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            data.put((String) pairs[i], pairs[i + 1]);
        }
        return data;
    }

    @Nested
    @DisplayName("get/put/delete")
    class Crud {

        @Test
        @DisplayName("partial Key에는 증가하는 id가 할당된다")
        void allocatesIds() {
            // When
            Key first = put(Key.of("Thing"), List.of(), data("n", 1L));
            Key second = put(Key.of("Thing"), List.of(), data("n", 2L));

            // Then
            assertThat(first.intId()).isNotNull();
            assertThat(second.intId()).isGreaterThan(first.intId());
            assertThat(adapter.size()).isEqualTo(2);
        }

        @Test
        @DisplayName("반환된 데이터는 저장소와 공유되지 않는다")
        void returnsCopies() {
            // Given
            Key key = put(Key.of("Thing", "a"), List.of(), data("bytes", new byte[]{1, 2}));

            // When
            Map<String, Object> loaded = adapter.getMulti(List.of(key)).get(0);
            ((byte[]) loaded.get("bytes"))[0] = 9;

            // Then
            byte[] reloaded = (byte[]) adapter.getMulti(List.of(key)).get(0).get("bytes");
            assertThat(reloaded).containsExactly(1, 2);
        }

        @Test
        @DisplayName("삭제와 clear")
        void deleteAndClear() {
            // Given
            Key a = put(Key.of("Thing", "a"), List.of(), data());
            Key b = put(Key.of("Thing", "b"), List.of(), data());

            // When
            adapter.deleteMulti(List.of(a));

            // Then
            assertThat(adapter.getMulti(List.of(a, b))).containsExactly(null, Map.of());
            adapter.clear();
            assertThat(adapter.size()).isZero();
        }
    }

    @Nested
    @DisplayName("query")
    class Queries {

        @Test
        @DisplayName("인덱스되지 않았거나 없는 필드의 필터는 일치하지 않는다")
        void unindexedAndMissingFieldsNeverMatch() {
            // Given
            put(Key.of("Thing", "indexed"), List.of(), data("n", 1L));
            put(Key.of("Thing", "unindexed"), List.of("n"), data("n", 1L));
            put(Key.of("Thing", "missing"), List.of(), data());

            // When
            QueryResponse response = adapter.query(
                Query.of("Thing").where(new PropertyFilter("n", PropertyFilter.Operator.EQ, 1L)),
                new QueryOptions());

            // Then
            assertThat(response.entities()).extracting(QueryResponse.Entry::key)
                .containsExactly(Key.of("Thing", "indexed"));
        }

        @Test
        @DisplayName("리스트 값은 원소 중 하나라도 일치하면 필터를 통과한다")
        void listValuesMatchAnyElement() {
            // Given
            put(Key.of("Thing", "tags"), List.of(), data("tag", List.of("red", "blue")));

            // When
            QueryResponse response = adapter.query(
                Query.of("Thing").where(new PropertyFilter("tag", PropertyFilter.Operator.EQ, "blue")),
                new QueryOptions());

            // Then
            assertThat(response.entities()).hasSize(1);
        }

        @Test
        @DisplayName("keys-only 응답에는 데이터가 없다")
        void keysOnlyOmitsData() {
            // Given
            put(Key.of("Thing", "a"), List.of(), data("n", 1L));

            // When
            QueryResponse response = adapter.query(Query.of("Thing"), new QueryOptions().withKeysOnly(true));

            // Then
            assertThat(response.entities().get(0).data()).isNull();
        }

        @Test
        @DisplayName("응답 커서로 다음 위치부터 이어서 조회한다")
        void cursorResumesAfterLastResult() {
            // Given
            for (int i = 0; i < 5; i++) {
                put(Key.of("Thing"), List.of(), data("n", (long) i));
            }
            Query query = Query.of("Thing");

            // When
            QueryResponse first = adapter.query(query, new QueryOptions().withLimit(2));
            QueryResponse second = adapter.query(query, new QueryOptions().withLimit(10).withCursor(first.cursor()));

            // Then
            List<Key> all = new ArrayList<>();
            first.entities().forEach(entry -> all.add(entry.key()));
            second.entities().forEach(entry -> all.add(entry.key()));
            assertThat(all).hasSize(5).doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("잘못된 커서는 IllegalArgumentException")
        void invalidCursorIsRejected() {
            assertThatThrownBy(() -> adapter.query(Query.of("Thing"), new QueryOptions().withCursor("!!not-base64")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid cursor");
        }
    }

    @Nested
    @DisplayName("transaction")
    class Transactions {

        @Test
        @DisplayName("트랜잭션 안의 쓰기는 커밋 전까지 보이지 않는다")
        void writesAreBufferedUntilCommit() {
            // Given
            Transaction transaction = adapter.transaction(Propagation.NESTED);
            transaction.begin();

            // When
            Key key = put(Key.of("Thing", "buffered"), List.of(), data("n", 1L));

            // Then
            assertThat(adapter.getMulti(List.of(key)).get(0)).isNull();
            transaction.commit();
            transaction.end();
            assertThat(adapter.getMulti(List.of(key)).get(0)).containsEntry("n", 1L);
            assertThat(adapter.inTransaction()).isFalse();
        }

        @Test
        @DisplayName("읽은 엔티티가 바뀌면 커밋이 실패한다")
        void commitFailsOnConflict() {
            // Given
            Key key = put(Key.of("Thing", "contended"), List.of(), data("n", 1L));
            Transaction transaction = adapter.transaction(Propagation.INDEPENDENT);
            transaction.begin();
            adapter.getMulti(List.of(key));
            Transaction other = adapter.transaction(Propagation.INDEPENDENT);
            other.begin();
            put(key, List.of(), data("n", 2L));
            other.commit();
            other.end();

            // When & Then
            assertThatThrownBy(transaction::commit).isInstanceOf(TransactionFailedException.class);
            transaction.end();
            assertThat(adapter.getMulti(List.of(key)).get(0)).containsEntry("n", 2L);
        }

        @Test
        @DisplayName("읽은 뒤 다른 스레드가 삭제 후 다시 저장해도 커밋이 실패한다")
        void commitFailsWhenEntityIsRecreated() {
            // Given
            Key key = put(Key.of("Account", 1L), List.of(), data("balance", 100L));
            Transaction transaction = adapter.transaction(Propagation.INDEPENDENT);
            transaction.begin();
            adapter.getMulti(List.of(key));
            CompletableFuture.runAsync(() -> {
                adapter.deleteMulti(List.of(key));
                put(key, List.of(), data("balance", 5L));
            }).join();

            // When
            put(key, List.of(), data("balance", 150L));

            // Then
            assertThatThrownBy(transaction::commit).isInstanceOf(TransactionFailedException.class);
            transaction.end();
            assertThat(adapter.getMulti(List.of(key)).get(0)).containsEntry("balance", 5L);
        }

        @Test
        @DisplayName("NESTED 트랜잭션은 현재 트랜잭션에 합류한다")
        void nestedJoinsCurrent() {
            // Given
            Transaction outer = adapter.transaction(Propagation.NESTED);
            outer.begin();
            Transaction inner = adapter.transaction(Propagation.NESTED);
            inner.begin();

            // When
            Key key = put(Key.of("Thing", "joined"), List.of(), data());
            inner.commit();
            inner.end();

            // Then
            assertThat(adapter.currentTransaction()).isSameAs(outer);
            assertThat(adapter.getMulti(List.of(key)).get(0)).isNull();
            outer.commit();
            outer.end();
            assertThat(adapter.getMulti(List.of(key)).get(0)).isNotNull();
        }
    }
}
