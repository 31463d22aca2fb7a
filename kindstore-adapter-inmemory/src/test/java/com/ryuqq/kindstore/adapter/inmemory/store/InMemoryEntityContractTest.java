package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.testkit.contract.EntityContractTest;

/**
 * {@link InMemoryAdapter}에 대한 {@link EntityContractTest} 실행.
 */
class InMemoryEntityContractTest extends EntityContractTest {

    @Override
    protected Adapter createAdapter() {
        return new InMemoryAdapter();
    }
}
