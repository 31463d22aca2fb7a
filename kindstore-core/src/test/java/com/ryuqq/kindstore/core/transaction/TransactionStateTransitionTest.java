package com.ryuqq.kindstore.core.transaction;

import org.junit.jupiter.api.Test;

import static com.ryuqq.kindstore.core.transaction.TransactionState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * TransactionStateTransition 테스트.
 *
 * <ul>
 *   <li>정상 전이 (CREATED → BEGUN → COMMITTED → ENDED) 성공</li>
 *   <li>정상 전이 (CREATED → BEGUN → ROLLED_BACK → ENDED) 성공</li>
 *   <li>ENDED에서의 모든 전이는 IllegalStateException</li>
 *   <li>COMMITTED → ROLLED_BACK 시도 시 IllegalStateException</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
class TransactionStateTransitionTest {

    // ========== 정상 전이 테스트 ==========

    @Test
    void transition_CommitFlow_Succeeds() {
        // Given
        TransactionState state = CREATED;

        // When
        state = TransactionStateTransition.transition(state, BEGUN);
        state = TransactionStateTransition.transition(state, COMMITTED);
        state = TransactionStateTransition.transition(state, ENDED);

        // Then
        assertEquals(ENDED, state);
        assertTrue(state.isTerminal());
    }

    @Test
    void transition_RollbackFlow_Succeeds() {
        // Given
        TransactionState state = CREATED;

        // When
        state = TransactionStateTransition.transition(state, BEGUN);
        state = TransactionStateTransition.transition(state, ROLLED_BACK);

        // Then
        assertEquals(ROLLED_BACK, state);
        assertTrue(state.isFinished());
        assertFalse(state.isTerminal());
    }

    @Test
    void validate_CreatedToEnded_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> TransactionStateTransition.validate(CREATED, ENDED));
    }

    // ========== 불법 전이 테스트 ==========

    @Test
    void validate_CreatedToCommitted_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> TransactionStateTransition.validate(CREATED, COMMITTED)
        );
        assertTrue(exception.getMessage().contains("Invalid state transition"));
    }

    @Test
    void validate_CommittedToRolledBack_ThrowsException() {
        // When & Then
        assertThrows(
            IllegalStateException.class,
            () -> TransactionStateTransition.validate(COMMITTED, ROLLED_BACK)
        );
    }

    @Test
    void validate_FromEnded_ThrowsException() {
        // When & Then
        for (TransactionState target : TransactionState.values()) {
            IllegalStateException exception = assertThrows(
                IllegalStateException.class,
                () -> TransactionStateTransition.validate(ENDED, target)
            );
            assertTrue(exception.getMessage().contains("terminal state"));
        }
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> TransactionStateTransition.validate(null, BEGUN));
        assertThrows(IllegalArgumentException.class, () -> TransactionStateTransition.validate(BEGUN, null));
    }
}
