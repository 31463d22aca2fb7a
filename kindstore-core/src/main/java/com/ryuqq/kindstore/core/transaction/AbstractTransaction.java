package com.ryuqq.kindstore.core.transaction;

/**
 * {@link Transaction} 기본 구현 (상태 기계 템플릿).
 *
 * <p>상태 전이는 {@link TransactionStateTransition}으로 검증하고, 실제 작업은
 * 하위 클래스의 {@code doXxx} 메서드에 위임합니다.</p>
 *
 * <p><strong>멱등성:</strong></p>
 * <ul>
 *   <li>이미 ROLLED_BACK 또는 ENDED 상태에서 rollback은 아무 것도 하지 않음</li>
 *   <li>이미 ENDED 상태에서 end는 아무 것도 하지 않음</li>
 *   <li>doCommit이 예외를 던지면 상태는 BEGUN으로 유지되어 rollback/end가 가능</li>
 * </ul>
 *
 * <p>하나의 트랜잭션은 하나의 스레드에서만 사용되므로 동기화하지 않습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class AbstractTransaction implements Transaction {

    private TransactionState state = TransactionState.CREATED;

    @Override
    public final void begin() {
        TransactionStateTransition.validate(state, TransactionState.BEGUN);
        doBegin();
        state = TransactionState.BEGUN;
    }

    @Override
    public final void commit() {
        TransactionStateTransition.validate(state, TransactionState.COMMITTED);
        doCommit();
        state = TransactionState.COMMITTED;
    }

    @Override
    public final void rollback() {
        if (state == TransactionState.ROLLED_BACK || state == TransactionState.ENDED) {
            return;
        }
        TransactionStateTransition.validate(state, TransactionState.ROLLED_BACK);
        try {
            doRollback();
        } finally {
            state = TransactionState.ROLLED_BACK;
        }
    }

    @Override
    public final void end() {
        if (state == TransactionState.ENDED) {
            return;
        }
        try {
            doEnd();
        } finally {
            state = TransactionStateTransition.transition(state, TransactionState.ENDED);
        }
    }

    @Override
    public TransactionState state() {
        return state;
    }

    /**
     * 트랜잭션 시작 작업.
     */
    protected abstract void doBegin();

    /**
     * 커밋 작업.
     *
     * @throws TransactionFailedException 충돌로 커밋할 수 없는 경우
     */
    protected abstract void doCommit();

    /**
     * 롤백 작업.
     */
    protected abstract void doRollback();

    /**
     * 정리 작업 (스택에서 제거 포함).
     */
    protected abstract void doEnd();
}
