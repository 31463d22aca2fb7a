package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.testkit.contract.QueryContractTest;

/**
 * {@link InMemoryAdapter}에 대한 {@link QueryContractTest} 실행.
 */
class InMemoryQueryContractTest extends QueryContractTest {

    @Override
    protected Adapter createAdapter() {
        return new InMemoryAdapter();
    }
}
