package com.ryuqq.kindstore.core.query;

import com.ryuqq.kindstore.core.fixture.Circle;
import com.ryuqq.kindstore.core.fixture.Gadget;
import com.ryuqq.kindstore.core.fixture.Shape;
import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;
import com.ryuqq.kindstore.core.namespace.Namespaces;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Query 생성과 준비 테스트.
 */
class QueryTest {

    @BeforeAll
    static void registerModels() {
        ModelRegistry.schemaOf(Gadget.class);
        ModelRegistry.schemaOf(Circle.class);
    }

    @AfterEach
    void tearDown() {
        Namespaces.clear();
    }

    @Test
    @DisplayName("파생 메서드는 원본을 바꾸지 않고 새 쿼리를 반환한다")
    void immutable() {
        // Given
        Query base = Gadget.SCHEMA.query();

        // When
        Query filtered = base.where(Gadget.NAME.eq("lamp")).withLimit(5).withOffset(2);

        // Then
        assertThat(base.filters()).isEmpty();
        assertThat(base.limit()).isNull();
        assertThat(base.offset()).isZero();
        assertThat(filtered.filters()).containsExactly(Gadget.NAME.eq("lamp"));
        assertThat(filtered.limit()).isEqualTo(5);
        assertThat(filtered.offset()).isEqualTo(2);
    }

    @Test
    @DisplayName("where는 필터를 대체하고 andWhere는 추가한다")
    void whereAndAndWhere() {
        Query query = Gadget.SCHEMA.query()
            .where(Gadget.NAME.eq("lamp"))
            .andWhere(Gadget.COUNT.gt(1L));

        assertThat(query.filters()).containsExactly(Gadget.NAME.eq("lamp"), Gadget.COUNT.gt(1L));
        assertThat(query.where(Gadget.ENABLED.isTrue()).filters()).containsExactly(Gadget.ENABLED.isTrue());
    }

    @Test
    @DisplayName("select와 orderBy는 wire 필드 이름을 사용한다")
    void projectionAndOrder() {
        Query query = Gadget.SCHEMA.query().select(Gadget.NAME, Gadget.COUNT).orderBy(Gadget.COUNT.desc());

        assertThat(query.projection()).containsExactly("name", "count");
        assertThat(query.orders()).containsExactly(Gadget.COUNT.desc());
    }

    @Test
    @DisplayName("namespace를 지정하지 않으면 생성 시점의 현재 namespace를 사용한다")
    void capturesNamespace() {
        Namespaces.set("tenant-a");
        Query query = Query.of("Gadget");
        Namespaces.clear();

        assertThat(query.namespace()).isEqualTo("tenant-a");
        assertThat(query.withNamespace("other").namespace()).isEqualTo("other");
    }

    @Test
    @DisplayName("음수 offset과 limit은 허용하지 않는다")
    void rejectsNegativeBounds() {
        assertThatThrownBy(() -> Query.of("Gadget").withOffset(-1))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Query.of("Gadget").withLimit(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("다형성 자식 쿼리는 루트 kind와 kindChain 필터로 재작성된다")
    void preparesChildQuery() {
        // Given
        Query query = Circle.SCHEMA.query().where(Circle.RADIUS.gt(1.0)).withAncestor(Key.of("Gadget", 1L));

        // When
        Query prepared = query.prepare();

        // Then
        assertThat(prepared.kind()).isEqualTo("Shape");
        assertThat(prepared.ancestor()).isEqualTo(Key.of("Gadget", 1L));
        assertThat(prepared.filters()).containsExactly(
            Circle.RADIUS.gt(1.0),
            new PropertyFilter(Model.KINDS_FIELD, PropertyFilter.Operator.EQ, "Circle"));
    }

    @Test
    @DisplayName("루트, 일반, kind 없는 쿼리는 그대로 실행된다")
    void preparesOtherQueries() {
        Query root = Shape.SCHEMA.query();
        Query plain = Gadget.SCHEMA.query();
        Query kindless = Query.kindless();

        assertThat(root.prepare()).isEqualTo(root);
        assertThat(plain.prepare()).isEqualTo(plain);
        assertThat(kindless.prepare()).isEqualTo(kindless);
        assertThat(kindless.kind()).isNull();
    }
}
