package com.ryuqq.kindstore.core.query;

import java.util.Iterator;
import java.util.List;

/**
 * 쿼리 결과의 한 페이지.
 *
 * @param number 1부터 시작하는 페이지 번호
 * @param items 페이지 결과
 * @param cursor 이 페이지 직후부터 이어서 조회할 수 있는 커서
 * @param <T> 결과 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public record Page<T>(int number, List<T> items, String cursor) implements Iterable<T> {

    public Page {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    @Override
    public Iterator<T> iterator() {
        return items.iterator();
    }
}
