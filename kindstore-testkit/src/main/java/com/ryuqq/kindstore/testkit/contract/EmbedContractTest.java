package com.ryuqq.kindstore.testkit.contract;

import com.ryuqq.kindstore.core.model.Entities;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.testkit.model.DeepA;
import com.ryuqq.kindstore.testkit.model.DeepB;
import com.ryuqq.kindstore.testkit.model.DeepC;
import com.ryuqq.kindstore.testkit.model.DeepD;
import com.ryuqq.kindstore.testkit.model.Nested;
import com.ryuqq.kindstore.testkit.model.Outer;
import com.ryuqq.kindstore.testkit.model.Product;
import com.ryuqq.kindstore.testkit.model.Variation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Embedded model contract.
 *
 * <p>내장 모델은 {@code 속성.필드} 형태의 평탄화된 wire 필드로 저장되며,
 * 내장 필드도 인덱스되어 있으면 쿼리할 수 있습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class EmbedContractTest extends AbstractAdapterContractTest {

    @Test
    @DisplayName("단일 내장 모델을 저장하고 복원한다")
    void singleEmbedRoundTrip() {
        // Given
        Outer outer = Entities.put(Outer.of(1.5, Nested.of(2.5, 3.5)));

        // When
        Outer loaded = Entities.get(outer.getKey(), Outer.class);

        // Then
        assertThat(loaded).isEqualTo(outer);
        assertThat(loaded.get(Outer.NESTED).get(Nested.Z)).isEqualTo(3.5);
        assertThat(outer.toEntityData()).containsKeys("x", "nested.y", "nested.z");
    }

    @Test
    @DisplayName("내장 모델의 인덱스되지 않은 필드는 접두사와 함께 보고된다")
    void unindexedNamesArePrefixed() {
        assertThat(Outer.of(1, Nested.of(2, 3)).unindexedProperties()).containsExactly("nested.y");
        assertThat(Product.of("shirt", List.of(Variation.of("S", 1))).unindexedProperties()).isEmpty();
        assertThat(DeepA.of(7).unindexedProperties()).containsExactly("child.child.child.x");
    }

    @Test
    @DisplayName("내장 필드로 쿼리한다")
    void queryByEmbeddedField() {
        // Given
        Outer.of(1, Nested.of(10, 100)).put();
        Outer match = Entities.put(Outer.of(2, Nested.of(20, 200)));

        // When
        Model found = Outer.SCHEMA.query()
            .where(Outer.NESTED.field(Nested.Z).eq(200.0))
            .get();

        // Then
        assertThat(found).isEqualTo(match);
        assertThatThrownBy(() -> Outer.NESTED.field(Nested.Y).eq(20.0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("필수 내장 속성이 비어 있으면 저장이 거부된다")
    void requiredEmbedMustBePresent() {
        // Given
        Outer outer = new Outer();
        outer.set(Outer.X, 1.0);

        // When & Then
        assertThatThrownBy(outer::put).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("repeated 내장 모델은 열 단위로 저장되고 순서대로 복원된다")
    void repeatedEmbedRoundTrip() {
        // Given
        Product product = Entities.put(Product.of("shirt", List.of(Variation.of("S", 10), Variation.of("M", 20))));

        // When
        Product loaded = Entities.get(product.getKey(), Product.class);

        // Then
        assertThat(product.toEntityData())
            .containsKey("variations.name")
            .containsEntry("variations.weight", List.of(10L, 20L));
        assertThat(loaded).isEqualTo(product);
        List<Variation> variations = loaded.getAll(Product.VARIATIONS);
        assertThat(variations).extracting(v -> v.get(Variation.NAME)).containsExactly("S", "M");
    }

    @Test
    @DisplayName("repeated 내장 필드 쿼리는 원소 중 하나라도 일치하면 반환한다")
    void queryByRepeatedEmbeddedField() {
        // Given
        Product shirt = Entities.put(Product.of("shirt", List.of(Variation.of("S", 10), Variation.of("M", 20))));
        Product.of("hat", List.of(Variation.of("L", 30))).put();

        // When
        List<Model> results = Product.SCHEMA.query()
            .where(Product.VARIATIONS.field(Variation.WEIGHT).eq(20L))
            .run()
            .toList();

        // Then
        assertThat(results).containsExactly(shirt);
    }

    @Test
    @DisplayName("깊게 중첩된 내장 모델을 저장하고 복원한다")
    void deepEmbedRoundTrip() {
        // Given
        DeepA deep = Entities.put(DeepA.of(42));

        // When
        DeepA loaded = Entities.get(deep.getKey(), DeepA.class);

        // Then
        assertThat(loaded).isEqualTo(deep);
        DeepD leaf = loaded.get(DeepA.CHILD).get(DeepB.CHILD).get(DeepC.CHILD);
        assertThat(leaf.get(DeepD.X)).isEqualTo(42L);
    }

    @Test
    @DisplayName("깊게 중첩된 인덱스되지 않은 필드로는 필터를 만들 수 없다")
    void deepUnindexedFieldCannotBeFiltered() {
        assertThatThrownBy(() -> DeepA.CHILD.field(DeepB.CHILD).field(DeepC.CHILD).field(DeepD.X).eq(42L))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
