package com.ryuqq.kindstore.core.transaction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

/**
 * 스레드별 트랜잭션 스택 테스트.
 */
class TransactionStackTest {

    private final TransactionStack<Transaction> stack = new TransactionStack<>();

    @Test
    @DisplayName("가장 최근에 push한 트랜잭션이 현재 트랜잭션이다")
    void currentIsInnermost() {
        Transaction outer = stack.push(mock(Transaction.class));
        Transaction inner = stack.push(mock(Transaction.class));

        assertThat(stack.current()).isSameAs(inner);
        assertThat(stack.depth()).isEqualTo(2);

        stack.remove(inner);
        assertThat(stack.current()).isSameAs(outer);
        stack.remove(outer);
        assertThat(stack.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("열린 트랜잭션이 없으면 current는 실패한다")
    void currentWithoutTransaction() {
        assertThatThrownBy(stack::current)
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("No transaction is open on the current thread");
    }

    @Test
    @DisplayName("다른 스레드의 트랜잭션은 보이지 않는다")
    void threadLocal() {
        stack.push(mock(Transaction.class));

        boolean emptyElsewhere = CompletableFuture.supplyAsync(stack::isEmpty).join();

        assertThat(emptyElsewhere).isTrue();
        assertThat(stack.isEmpty()).isFalse();
    }
}
