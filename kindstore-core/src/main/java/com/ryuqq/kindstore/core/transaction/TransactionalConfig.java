package com.ryuqq.kindstore.core.transaction;

/**
 * Transactional 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retries: 커밋 충돌 시 재시도 횟수 (기본 3, 즉 최대 4회 실행)</li>
 *   <li>propagation: 전파 방식 (기본 NESTED)</li>
 * </ul>
 *
 * @param retries 재시도 횟수 (0 이상)
 * @param propagation 전파 방식
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public record TransactionalConfig(int retries, Propagation propagation) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: retries=3, propagation=NESTED</p>
     */
    public TransactionalConfig() {
        this(3, Propagation.NESTED);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TransactionalConfig {
        if (retries < 0) {
            throw new IllegalArgumentException("retries must be non-negative (current: " + retries + ")");
        }
        if (propagation == null) {
            throw new IllegalArgumentException("propagation cannot be null");
        }
    }

    public TransactionalConfig withRetries(int retries) {
        return new TransactionalConfig(retries, propagation);
    }

    public TransactionalConfig withPropagation(Propagation propagation) {
        return new TransactionalConfig(retries, propagation);
    }
}
