package com.ryuqq.kindstore.adapter.inmemory.store;

import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.testkit.contract.PolymorphismContractTest;

/**
 * {@link InMemoryAdapter}에 대한 {@link PolymorphismContractTest} 실행.
 */
class InMemoryPolymorphismContractTest extends PolymorphismContractTest {

    @Override
    protected Adapter createAdapter() {
        return new InMemoryAdapter();
    }
}
