package com.ryuqq.kindstore.core.transaction;

/**
 * 트랜잭션 전파 방식.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public enum Propagation {

    /**
     * 현재 스레드에 열린 트랜잭션이 있으면 그 트랜잭션에 합류.
     *
     * <p>내부 트랜잭션의 begin/commit/rollback은 가장 바깥 트랜잭션에 위임되며,
     * 실제 커밋은 가장 바깥 트랜잭션의 commit에서만 일어납니다.
     * 열린 트랜잭션이 없으면 {@link #INDEPENDENT}와 동일하게 동작합니다.</p>
     */
    NESTED,

    /**
     * 항상 새로운 바깥 트랜잭션을 시작.
     *
     * <p>이미 열린 트랜잭션과 무관하게 독립적으로 커밋/롤백됩니다.</p>
     */
    INDEPENDENT
}
