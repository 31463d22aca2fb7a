package com.ryuqq.kindstore.core.transaction;

import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.Adapters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * 함수 본문을 트랜잭션 안에서 실행하는 재시도 래퍼.
 *
 * <p>쿼리를 제외한 모든 get/put/delete는 어댑터의 현재 트랜잭션에 참여합니다.</p>
 *
 * <p><strong>실행 규칙:</strong></p>
 * <ul>
 *   <li>매 시도마다 새 트랜잭션을 만들고 begin → 본문 → commit</li>
 *   <li>{@link TransactionFailedException}: 본문 전체를 재시도 (최대 retries회)</li>
 *   <li>그 외 예외: rollback 후 원래 예외를 그대로 다시 던짐</li>
 *   <li>end()는 모든 경로에서 항상 실행</li>
 *   <li>재시도 소진: 마지막 충돌을 cause로 {@link RetriesExceededException}</li>
 * </ul>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>{@code
 * Transactional transactional = Transactional.create();
 * transactional.run(() -> {
 *     List<BankAccount> accounts = Entities.getMulti(List.of(source, target));
 *     ...
 *     Entities.putMulti(accounts);
 * });
 * }</pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Transactional {

    private static final Logger log = LoggerFactory.getLogger(Transactional.class);

    private final Adapter adapter;
    private final TransactionalConfig config;

    /**
     * @param adapter 사용할 어댑터 (null이면 실행 시점의 전역 어댑터)
     * @param config 재시도/전파 설정
     * @throws IllegalArgumentException config가 null인 경우
     */
    public Transactional(Adapter adapter, TransactionalConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.adapter = adapter;
        this.config = config;
    }

    /**
     * 전역 어댑터와 기본 설정으로 생성.
     *
     * @return Transactional
     */
    public static Transactional create() {
        return new Transactional(null, new TransactionalConfig());
    }

    /**
     * 전역 어댑터와 주어진 설정으로 생성.
     *
     * @param config 설정
     * @return Transactional
     */
    public static Transactional create(TransactionalConfig config) {
        return new Transactional(null, config);
    }

    /**
     * 본문을 트랜잭션 안에서 실행하고 결과를 반환.
     *
     * @param body 실행할 본문
     * @param <T> 결과 타입
     * @return 본문의 결과
     * @throws RetriesExceededException 재시도를 모두 소진한 경우
     */
    public <T> T call(Supplier<T> body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }

        Adapter target = adapter != null ? adapter : Adapters.get();
        TransactionFailedException cause = null;
        int attempts = 0;
        while (attempts <= config.retries()) {
            attempts++;
            Transaction transaction = target.transaction(config.propagation());
            try {
                transaction.begin();
                T result = body.get();
                transaction.commit();
                return result;
            } catch (TransactionFailedException e) {
                cause = e;
                log.debug("Transaction failed (attempt {}/{}): {}",
                    attempts, config.retries() + 1, e.getMessage());
            } catch (RuntimeException | Error e) {
                transaction.rollback();
                throw e;
            } finally {
                transaction.end();
            }
        }

        log.warn("Transaction retries exceeded after {} attempts", attempts);
        throw new RetriesExceededException(cause);
    }

    /**
     * 본문을 트랜잭션 안에서 실행.
     *
     * @param body 실행할 본문
     * @throws RetriesExceededException 재시도를 모두 소진한 경우
     */
    public void run(Runnable body) {
        if (body == null) {
            throw new IllegalArgumentException("body cannot be null");
        }
        call(() -> {
            body.run();
            return null;
        });
    }

    public TransactionalConfig config() {
        return config;
    }
}
