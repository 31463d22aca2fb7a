package com.ryuqq.kindstore.core.query;

import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import com.ryuqq.kindstore.core.spi.QueryResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Function;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * 쿼리 결과를 배치 단위로 가져오는 전진 전용 시퀀스.
 *
 * <p><strong>배치 규칙:</strong></p>
 * <ul>
 *   <li>배치 크기 = min(남은 limit, batchSize)</li>
 *   <li>offset은 첫 번째 배치에만 적용</li>
 *   <li>요청보다 적게 돌아온 배치 또는 남은 limit이 0이면 완료</li>
 *   <li>각 배치는 직전 배치의 커서부터 이어서 조회</li>
 * </ul>
 *
 * <p>다시 조회하려면 쿼리를 새로 실행해야 합니다.</p>
 *
 * @param <T> 결과 타입 (엔티티 또는 Key)
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Resultset<T> implements Iterator<T> {

    private static final Logger log = LoggerFactory.getLogger(Resultset.class);

    private final Query query;
    private final Adapter adapter;
    private final QueryOptions options;
    private final Function<QueryResponse.Entry, T> mapper;
    private final Deque<T> buffer = new ArrayDeque<>();

    private String cursor;
    private Integer remaining;
    private boolean complete;
    private boolean first = true;

    Resultset(Query query, Adapter adapter, QueryOptions options, Function<QueryResponse.Entry, T> mapper) {
        this.query = query;
        this.adapter = adapter;
        this.options = options;
        this.mapper = mapper;
        this.cursor = options.cursor();
        this.remaining = options.limit();
    }

    /**
     * 마지막으로 가져온 배치 직후를 가리키는 커서.
     *
     * @return 커서 (아직 가져온 배치가 없으면 시작 커서)
     */
    public String cursor() {
        return cursor;
    }

    /**
     * 더 가져올 배치가 없는지 확인.
     *
     * @return 완료되었으면 true
     */
    public boolean isComplete() {
        return complete;
    }

    public Query query() {
        return query;
    }

    @Override
    public boolean hasNext() {
        while (buffer.isEmpty() && !complete) {
            buffer.addAll(fetchNextBatch());
        }
        return !buffer.isEmpty();
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Resultset is exhausted");
        }
        return buffer.poll();
    }

    /**
     * 남은 결과를 모두 가져와 리스트로 반환.
     *
     * @return 결과 리스트
     */
    public List<T> toList() {
        List<T> results = new ArrayList<>();
        while (hasNext()) {
            results.add(next());
        }
        return results;
    }

    public Stream<T> stream() {
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED), false);
    }

    /**
     * 다음 배치 조회.
     *
     * @return 배치 결과 (완료되었으면 빈 리스트)
     */
    List<T> fetchNextBatch() {
        if (complete) {
            return List.of();
        }

        int batchSize = options.batchSize();
        if (remaining != null) {
            batchSize = Math.min(remaining, batchSize);
        }
        if (batchSize <= 0) {
            complete = true;
            return List.of();
        }

        QueryOptions batchOptions = options
            .withBatchSize(batchSize)
            .withLimit(batchSize)
            .withOffset(first ? options.offset() : 0)
            .withCursor(cursor);
        first = false;

        QueryResponse response = adapter.query(query, batchOptions);
        List<QueryResponse.Entry> entries = response.entities();
        log.debug("Fetched batch of {} (requested {}) for {}", entries.size(), batchSize, query.kind());

        cursor = response.cursor();
        if (remaining != null) {
            remaining -= entries.size();
        }
        if (entries.size() < batchSize || (remaining != null && remaining <= 0)) {
            complete = true;
        }

        List<T> batch = new ArrayList<>(entries.size());
        for (QueryResponse.Entry entry : entries) {
            batch.add(mapper.apply(entry));
        }
        return batch;
    }
}
