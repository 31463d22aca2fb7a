package com.ryuqq.kindstore.adapter.cache;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.transaction.Transaction;

import java.util.Collection;

/**
 * 바깥 캐싱 트랜잭션에 합류하는 중첩 트랜잭션.
 *
 * <p>무효화 대상 Key는 바깥 트랜잭션으로 전달되어 바깥 커밋 시점에 무효화됩니다.
 * begin/commit/rollback은 백엔드의 중첩 트랜잭션에 위임합니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
final class CachingInnerTransaction extends CachingTransaction {

    private final CachingOuterTransaction outer;

    CachingInnerTransaction(CachingAdapter adapter, CachingOuterTransaction outer, Transaction backing) {
        super(adapter, backing);
        this.outer = outer;
    }

    CachingOuterTransaction outer() {
        return outer;
    }

    @Override
    void pushKeys(Collection<Key> keys) {
        outer.pushKeys(keys);
    }

    @Override
    protected void doCommit() {
        backing.commit();
    }
}
