package com.ryuqq.kindstore.core.query;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.model.Property;
import com.ryuqq.kindstore.core.namespace.Namespaces;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.Adapters;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import com.ryuqq.kindstore.core.spi.QueryResponse;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * 불변 쿼리.
 *
 * <p>모든 파생 메서드({@code select}, {@code where}, {@code orderBy} ...)는 새 Query를 반환합니다.</p>
 *
 * <p><strong>실행:</strong></p>
 * <ul>
 *   <li>{@link #run()}: 배치 단위로 가져오는 {@link Resultset}</li>
 *   <li>{@link #paginate(int)}: 커서를 가진 {@link Page} 시퀀스</li>
 *   <li>{@link #get()}: 첫 번째 결과 또는 null</li>
 *   <li>{@link #count()}: keys-only 조회로 개수 계산</li>
 * </ul>
 *
 * <p>다형성 자식 모델의 쿼리는 실행 전에 루트 kind와 {@code ^k = 모델 이름} 필터로 재작성됩니다
 * ({@link #prepare()}). 쿼리 결과로 로드된 엔티티는 get hook을 실행하지 않습니다.</p>
 *
 * @param kind 모델 이름 (null이면 kind 없는 쿼리)
 * @param ancestor 조상 Key (nullable)
 * @param namespace namespace
 * @param projection 조회할 wire 필드 이름 (비어있으면 전체)
 * @param filters 필터
 * @param orders 정렬
 * @param offset 건너뛸 결과 수
 * @param limit 최대 결과 수 (null이면 제한 없음)
 * @author Kindstore Team
 * @since 1.0.0
 */
public record Query(
    String kind,
    Key ancestor,
    String namespace,
    List<String> projection,
    List<PropertyFilter> filters,
    List<PropertyOrder> orders,
    int offset,
    Integer limit
) {

    public Query {
        if (namespace == null) {
            namespace = Namespaces.current();
        }
        projection = projection == null ? List.of() : List.copyOf(projection);
        filters = filters == null ? List.of() : List.copyOf(filters);
        orders = orders == null ? List.of() : List.copyOf(orders);
        if (offset < 0) {
            throw new IllegalArgumentException("offset must be non-negative (current: " + offset + ")");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must be non-negative (current: " + limit + ")");
        }
    }

    /**
     * 현재 namespace의 모델 쿼리.
     *
     * @param kind 모델 이름 (nullable)
     * @return 쿼리
     */
    public static Query of(String kind) {
        return new Query(kind, null, null, null, null, null, 0, null);
    }

    /**
     * 모든 kind에 대한 쿼리. 전역 어댑터에서 실행됩니다.
     *
     * @return kind 없는 쿼리
     */
    public static Query kindless() {
        return of(null);
    }

    // ========== Derivations ==========

    public Query withKind(String kind) {
        return new Query(kind, ancestor, namespace, projection, filters, orders, offset, limit);
    }

    public Query withAncestor(Key ancestor) {
        return new Query(kind, ancestor, namespace, projection, filters, orders, offset, limit);
    }

    public Query withNamespace(String namespace) {
        return new Query(kind, ancestor, namespace, projection, filters, orders, offset, limit);
    }

    public Query withOffset(int offset) {
        return new Query(kind, ancestor, namespace, projection, filters, orders, offset, limit);
    }

    public Query withLimit(Integer limit) {
        return new Query(kind, ancestor, namespace, projection, filters, orders, offset, limit);
    }

    /**
     * 프로젝션 지정 (기존 프로젝션 대체).
     *
     * @param fields wire 필드 이름
     */
    public Query select(String... fields) {
        return new Query(kind, ancestor, namespace, Arrays.asList(fields), filters, orders, offset, limit);
    }

    /**
     * 프로젝션 지정 (기존 프로젝션 대체).
     *
     * @param properties 조회할 속성
     */
    public Query select(Property<?>... properties) {
        List<String> fields = new ArrayList<>(properties.length);
        for (Property<?> property : properties) {
            fields.add(property.nameOnEntity());
        }
        return new Query(kind, ancestor, namespace, fields, filters, orders, offset, limit);
    }

    /**
     * 필터 지정 (기존 필터 대체).
     */
    public Query where(PropertyFilter... filters) {
        return new Query(kind, ancestor, namespace, projection, Arrays.asList(filters), orders, offset, limit);
    }

    /**
     * 필터 추가.
     */
    public Query andWhere(PropertyFilter... filters) {
        List<PropertyFilter> merged = new ArrayList<>(this.filters);
        merged.addAll(Arrays.asList(filters));
        return new Query(kind, ancestor, namespace, projection, merged, orders, offset, limit);
    }

    /**
     * 정렬 지정 (기존 정렬 대체).
     */
    public Query orderBy(PropertyOrder... orders) {
        return new Query(kind, ancestor, namespace, projection, filters, Arrays.asList(orders), offset, limit);
    }

    // ========== Preparation ==========

    /**
     * 실행용 쿼리로 변환.
     *
     * <p>다형성 자식 모델이면 kind를 루트 kind로 바꾸고 {@code ^k = 모델 이름} 필터를 추가합니다.</p>
     *
     * @return 준비된 쿼리
     * @throws IllegalStateException 알 수 없는 모델 이름인 경우
     */
    public Query prepare() {
        if (kind == null) {
            return this;
        }
        ModelSchema<?> schema = ModelRegistry.lookup(kind);
        if (!schema.isChild()) {
            return this;
        }
        return withKind(schema.kind())
            .andWhere(new PropertyFilter(Model.KINDS_FIELD, PropertyFilter.Operator.EQ, schema.modelName()));
    }

    private Adapter resolveAdapter() {
        if (kind == null) {
            return Adapters.get();
        }
        return ModelRegistry.lookup(kind).resolveAdapter();
    }

    private QueryOptions merge(QueryOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        QueryOptions merged = options;
        if (merged.offset() == 0 && offset > 0) {
            merged = merged.withOffset(offset);
        }
        if (merged.limit() == null && limit != null) {
            merged = merged.withLimit(limit);
        }
        return merged;
    }

    // ========== Execution ==========

    public Resultset<Model> run() {
        return run(new QueryOptions());
    }

    /**
     * 쿼리 실행.
     *
     * @param options 배치 크기, offset, limit, cursor (쿼리 값보다 우선)
     * @return 엔티티 Resultset
     */
    public Resultset<Model> run(QueryOptions options) {
        return new Resultset<>(prepare(), resolveAdapter(), merge(options).withKeysOnly(false), Query::loadEntry);
    }

    public Resultset<Key> runKeysOnly() {
        return runKeysOnly(new QueryOptions());
    }

    /**
     * Key만 조회.
     *
     * @param options 배치 크기, offset, limit, cursor
     * @return Key Resultset
     */
    public Resultset<Key> runKeysOnly(QueryOptions options) {
        return new Resultset<>(prepare(), resolveAdapter(), merge(options).withKeysOnly(true), QueryResponse.Entry::key);
    }

    /**
     * 첫 번째 결과 조회.
     *
     * @return 엔티티, 결과가 없으면 null
     */
    public Model get() {
        Resultset<Model> results = withLimit(1).run();
        return results.hasNext() ? results.next() : null;
    }

    /**
     * 결과 개수 계산 (offset, limit 적용).
     *
     * @return 결과 수
     */
    public int count() {
        Resultset<Key> keys = runKeysOnly();
        int count = 0;
        while (keys.hasNext()) {
            keys.next();
            count++;
        }
        return count;
    }

    public Pages<Model> paginate(int pageSize) {
        return paginate(pageSize, null);
    }

    /**
     * 페이지 단위 조회.
     *
     * @param pageSize 페이지 크기
     * @param cursor 이어서 조회할 커서 (nullable)
     * @return 페이지 시퀀스
     */
    public Pages<Model> paginate(int pageSize, String cursor) {
        QueryOptions options = new QueryOptions().withBatchSize(pageSize).withCursor(cursor);
        return new Pages<>(run(options));
    }

    static Model loadEntry(QueryResponse.Entry entry) {
        Key key = entry.key();
        return ModelRegistry.lookup(key.getKind()).load(key, entry.data() == null ? Map.of() : entry.data());
    }

    @Override
    public String toString() {
        return "Query(kind=" + kind + ", ancestor=" + ancestor + ", namespace='" + namespace
            + "', projection=" + projection + ", filters=" + filters + ", orders=" + orders
            + ", offset=" + offset + ", limit=" + limit + ")";
    }
}
