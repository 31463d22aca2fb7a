package com.ryuqq.kindstore.adapter.cache;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.transaction.Transaction;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * 최상위 캐싱 트랜잭션.
 *
 * <p>트랜잭션 중의 put/delete Key를 모았다가, 백엔드 커밋을 잠금/삭제로 감싸 무효화합니다.
 * 롤백되면 캐시를 건드리지 않습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
final class CachingOuterTransaction extends CachingTransaction {

    private final List<Key> batch = new ArrayList<>();

    CachingOuterTransaction(CachingAdapter adapter, Transaction backing) {
        super(adapter, backing);
    }

    @Override
    void pushKeys(Collection<Key> keys) {
        batch.addAll(keys);
    }

    List<Key> batch() {
        return List.copyOf(batch);
    }

    @Override
    protected void doCommit() {
        adapter.bust(batch, () -> {
            backing.commit();
            return null;
        });
    }

    @Override
    protected void doEnd() {
        batch.clear();
        super.doEnd();
    }
}
