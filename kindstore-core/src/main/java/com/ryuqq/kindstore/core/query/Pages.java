package com.ryuqq.kindstore.core.query;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * 쿼리 결과의 페이지 시퀀스.
 *
 * <p>각 페이지는 하나의 배치입니다. 반복(iteration)은 비어있지 않은 페이지만 반환하며,
 * {@link #fetchNextPage()}는 완료 후 빈 페이지를 반환합니다.</p>
 *
 * <pre>{@code
 * Pages<Model> pages = Person.SCHEMA.query().paginate(10);
 * Page<Model> first = pages.fetchNextPage();
 * String resumeFrom = pages.cursor();
 * }</pre>
 *
 * @param <T> 결과 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Pages<T> implements Iterable<Page<T>> {

    private final Resultset<T> resultset;
    private int pageNumber;

    Pages(Resultset<T> resultset) {
        this.resultset = resultset;
    }

    /**
     * @return 더 가져올 페이지가 있을 수 있으면 true
     */
    public boolean hasMore() {
        return !resultset.isComplete();
    }

    /**
     * @return 마지막으로 가져온 페이지 직후를 가리키는 커서
     */
    public String cursor() {
        return resultset.cursor();
    }

    /**
     * @return 지금까지 가져온 페이지 수
     */
    public int pageNumber() {
        return pageNumber;
    }

    /**
     * 다음 페이지 조회.
     *
     * @return 다음 페이지 (완료되었으면 빈 페이지)
     */
    public Page<T> fetchNextPage() {
        List<T> items = resultset.fetchNextBatch();
        if (!items.isEmpty()) {
            pageNumber++;
        }
        return new Page<>(pageNumber, items, resultset.cursor());
    }

    @Override
    public Iterator<Page<T>> iterator() {
        return new Iterator<>() {
            private Page<T> next;

            @Override
            public boolean hasNext() {
                while (next == null && hasMore()) {
                    Page<T> page = fetchNextPage();
                    if (!page.isEmpty()) {
                        next = page;
                    }
                }
                return next != null;
            }

            @Override
            public Page<T> next() {
                if (!hasNext()) {
                    throw new NoSuchElementException("No more pages");
                }
                Page<T> page = next;
                next = null;
                return page;
            }
        };
    }
}
