package com.ryuqq.kindstore.core.transaction;

/**
 * 트랜잭션 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CREATED → BEGUN</li>
 *   <li>CREATED → ROLLED_BACK (begin 실패 후 정리)</li>
 *   <li>BEGUN → COMMITTED</li>
 *   <li>BEGUN → ROLLED_BACK</li>
 *   <li>CREATED, BEGUN, COMMITTED, ROLLED_BACK → ENDED</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>ENDED에서는 어떤 상태로도 전이 불가</li>
 *   <li>COMMITTED ↔ ROLLED_BACK 전이 불가</li>
 *   <li>BEGUN → ENDED는 커밋 실패 후 정리이며, 변경 사항은 폐기됩니다</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class TransactionStateTransition {

    private TransactionStateTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(TransactionState from, TransactionState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (from.isTerminal()) {
            throw new IllegalStateException(
                String.format("Cannot transition from terminal state: %s → %s", from, to)
            );
        }

        boolean valid = switch (from) {
            case CREATED -> to == TransactionState.BEGUN
                || to == TransactionState.ROLLED_BACK
                || to == TransactionState.ENDED;
            case BEGUN -> to == TransactionState.COMMITTED
                || to == TransactionState.ROLLED_BACK
                || to == TransactionState.ENDED;
            case COMMITTED, ROLLED_BACK -> to == TransactionState.ENDED;
            case ENDED -> false;
        };

        if (!valid) {
            throw new IllegalStateException(
                String.format("Invalid state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static TransactionState transition(TransactionState current, TransactionState next) {
        validate(current, next);
        return next;
    }
}
