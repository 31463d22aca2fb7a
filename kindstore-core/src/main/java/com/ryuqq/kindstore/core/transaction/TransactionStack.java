package com.ryuqq.kindstore.core.transaction;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * 스레드별 트랜잭션 스택.
 *
 * <p>어댑터 인스턴스마다 하나씩 보유하며, 각 스레드는 자신의 스택만 봅니다.
 * 스택이 비면 ThreadLocal 값을 제거합니다.</p>
 *
 * @param <T> 트랜잭션 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class TransactionStack<T extends Transaction> {

    private final ThreadLocal<Deque<T>> stack = new ThreadLocal<>();

    /**
     * 트랜잭션을 스택에 추가.
     *
     * @param transaction 추가할 트랜잭션
     * @return 추가한 트랜잭션
     * @throws IllegalArgumentException transaction이 null인 경우
     */
    public T push(T transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction cannot be null");
        }
        Deque<T> deque = stack.get();
        if (deque == null) {
            deque = new ArrayDeque<>();
            stack.set(deque);
        }
        deque.push(transaction);
        return transaction;
    }

    /**
     * 트랜잭션을 스택에서 제거.
     *
     * <p>스택에 없는 트랜잭션이면 아무 것도 하지 않습니다.</p>
     *
     * @param transaction 제거할 트랜잭션
     */
    public void remove(T transaction) {
        Deque<T> deque = stack.get();
        if (deque == null) {
            return;
        }
        deque.removeFirstOccurrence(transaction);
        if (deque.isEmpty()) {
            stack.remove();
        }
    }

    /**
     * 가장 안쪽 트랜잭션 조회.
     *
     * @return 현재 트랜잭션
     * @throws IllegalStateException 열린 트랜잭션이 없는 경우
     */
    public T current() {
        Deque<T> deque = stack.get();
        if (deque == null || deque.isEmpty()) {
            throw new IllegalStateException("No transaction is open on the current thread");
        }
        return deque.peek();
    }

    /**
     * 열린 트랜잭션이 있는지 확인.
     *
     * @return 스택이 비어있지 않으면 true
     */
    public boolean isEmpty() {
        Deque<T> deque = stack.get();
        return deque == null || deque.isEmpty();
    }

    /**
     * 현재 스레드의 스택 깊이.
     *
     * @return 열린 트랜잭션 수
     */
    public int depth() {
        Deque<T> deque = stack.get();
        return deque == null ? 0 : deque.size();
    }
}
