package com.ryuqq.kindstore.core.transaction;

/**
 * Transaction의 생명주기 상태.
 *
 * <p><strong>상태 전이 다이어그램:</strong></p>
 * <pre>
 * CREATED
 *    │
 *    ▼ (begin)
 * BEGUN
 *    │
 *    ├─► COMMITTED (commit)
 *    │
 *    └─► ROLLED_BACK (rollback)
 *
 * 모든 상태 ─► ENDED (end, 항상 실행)
 * </pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public enum TransactionState {

    /**
     * 생성됨 (아직 begin 전).
     */
    CREATED,

    /**
     * 진행 중.
     */
    BEGUN,

    /**
     * 커밋 완료.
     */
    COMMITTED,

    /**
     * 롤백 완료.
     */
    ROLLED_BACK,

    /**
     * 종료 (스택에서 제거됨).
     */
    ENDED;

    /**
     * 종료 상태인지 확인.
     *
     * @return ENDED이면 true
     */
    public boolean isTerminal() {
        return this == ENDED;
    }

    /**
     * 더 이상 커밋/롤백할 수 없는 상태인지 확인.
     *
     * @return COMMITTED, ROLLED_BACK, ENDED이면 true
     */
    public boolean isFinished() {
        return this == COMMITTED || this == ROLLED_BACK || this == ENDED;
    }
}
