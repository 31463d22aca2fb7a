package com.ryuqq.kindstore.adapter.cache;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.transaction.AbstractTransaction;
import com.ryuqq.kindstore.core.transaction.Transaction;

import java.util.Collection;

/**
 * 백엔드 트랜잭션을 감싸고 캐시 무효화 대상 Key를 모으는 트랜잭션.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
abstract class CachingTransaction extends AbstractTransaction {

    protected final CachingAdapter adapter;
    protected final Transaction backing;

    CachingTransaction(CachingAdapter adapter, Transaction backing) {
        this.adapter = adapter;
        this.backing = backing;
    }

    /**
     * 커밋 시 무효화할 Key 추가.
     *
     * @param keys 쓰기 대상 Key
     */
    abstract void pushKeys(Collection<Key> keys);

    Transaction backing() {
        return backing;
    }

    @Override
    protected void doBegin() {
        backing.begin();
    }

    @Override
    protected void doRollback() {
        backing.rollback();
    }

    @Override
    protected void doEnd() {
        try {
            backing.end();
        } finally {
            adapter.release(this);
        }
    }
}
