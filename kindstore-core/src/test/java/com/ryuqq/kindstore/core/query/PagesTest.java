package com.ryuqq.kindstore.core.query;

import com.ryuqq.kindstore.core.fixture.Gadget;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.Adapters;
import com.ryuqq.kindstore.core.spi.QueryOptions;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.ArrayList;
import java.util.List;

import static com.ryuqq.kindstore.core.query.ResultsetTest.batch;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * 페이지 조회 테스트.
 */
class PagesTest {

    private Adapter adapter;

    @BeforeAll
    static void registerModels() {
        ModelRegistry.schemaOf(Gadget.class);
    }

    @BeforeEach
    void setUp() {
        adapter = Adapters.set(mock(Adapter.class));
    }

    @AfterEach
    void tearDown() {
        Adapters.clear();
    }

    @Test
    @DisplayName("페이지마다 번호와 다음 페이지 커서를 가진다")
    void fetchesPages() {
        // Given
        when(adapter.query(any(), any()))
            .thenReturn(batch(0, 2, "c1"), batch(2, 2, "c2"), batch(4, 1, "c3"));
        Pages<Model> pages = Gadget.SCHEMA.query().paginate(2);

        // When
        Page<Model> first = pages.fetchNextPage();
        Page<Model> second = pages.fetchNextPage();
        Page<Model> third = pages.fetchNextPage();

        // Then
        assertThat(first.number()).isEqualTo(1);
        assertThat(first.cursor()).isEqualTo("c1");
        assertThat(second.number()).isEqualTo(2);
        assertThat(third.size()).isEqualTo(1);
        assertThat(third.cursor()).isEqualTo("c3");
        assertThat(pages.hasMore()).isFalse();
        assertThat(pages.pageNumber()).isEqualTo(3);
    }

    @Test
    @DisplayName("완료된 뒤 fetchNextPage는 빈 페이지를 반환한다")
    void emptyPageAfterCompletion() {
        when(adapter.query(any(), any())).thenReturn(batch(0, 1, "c1"));
        Pages<Model> pages = Gadget.SCHEMA.query().paginate(5);

        pages.fetchNextPage();
        Page<Model> after = pages.fetchNextPage();

        assertThat(after.isEmpty()).isTrue();
        assertThat(after.number()).isEqualTo(1);
    }

    @Test
    @DisplayName("반복은 비어있지 않은 페이지만 반환한다")
    void iterationSkipsEmptyPages() {
        when(adapter.query(any(), any())).thenReturn(batch(0, 2, "c1"), batch(2, 2, "c2"), batch(4, 0, "c3"));

        List<Integer> sizes = new ArrayList<>();
        for (Page<Model> page : Gadget.SCHEMA.query().paginate(2)) {
            sizes.add(page.size());
        }

        assertThat(sizes).containsExactly(2, 2);
    }

    @Test
    @DisplayName("커서를 주면 그 지점부터 이어서 조회한다")
    void resumesFromCursor() {
        when(adapter.query(any(), any())).thenReturn(batch(10, 2, "c11"));

        Gadget.SCHEMA.query().paginate(2, "c9").fetchNextPage();

        ArgumentCaptor<QueryOptions> captor = ArgumentCaptor.forClass(QueryOptions.class);
        verify(adapter).query(any(Query.class), captor.capture());
        assertThat(captor.getValue().cursor()).isEqualTo("c9");
        assertThat(captor.getValue().batchSize()).isEqualTo(2);
    }
}
