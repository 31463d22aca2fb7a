package com.ryuqq.kindstore.testkit.contract;

import com.ryuqq.kindstore.core.model.Entities;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.testkit.model.Animal;
import com.ryuqq.kindstore.testkit.model.Bird;
import com.ryuqq.kindstore.testkit.model.Cat;
import com.ryuqq.kindstore.testkit.model.Eagle;
import com.ryuqq.kindstore.testkit.model.Human;
import com.ryuqq.kindstore.testkit.model.Mammal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Polymorphic model contract.
 *
 * <p>계층 전체가 루트 kind 하나에 저장되며, 하위 모델 쿼리는 클래스 계층 필드로 범위가 좁혀집니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class PolymorphismContractTest extends AbstractAdapterContractTest {

    private Cat cat;
    private Human human;
    private Eagle eagle;

    @BeforeEach
    void seedAnimals() {
        cat = Animal.named(new Cat(), "Garfield");
        human = Animal.named(new Human(), "Alice");
        eagle = Animal.named(new Eagle(), "Sam");
        eagle.set(Bird.WINGSPAN, 200L);
        putAll(cat, human, eagle);
    }

    private static List<String> names(List<Model> animals) {
        List<String> names = new ArrayList<>();
        for (Model animal : animals) {
            names.add(((Animal) animal).getName());
        }
        return names;
    }

    @Test
    @DisplayName("하위 모델은 루트 kind로 저장된다")
    void childrenAreStoredUnderRootKind() {
        assertThat(cat.getKey().getKind()).isEqualTo("Animal");
        assertThat(eagle.getKey().getKind()).isEqualTo("Animal");
        assertThat(Cat.SCHEMA.kindChain()).containsExactly("Cat", "Mammal", "Animal");
    }

    @Test
    @DisplayName("Key로 조회하면 가장 구체적인 클래스로 복원된다")
    void getRestoresConcreteClass() {
        // When
        Model loadedCat = Entities.get(cat.getKey());
        Model loadedEagle = Entities.get(eagle.getKey());

        // Then
        assertThat(loadedCat).isInstanceOf(Cat.class).isEqualTo(cat);
        assertThat(loadedEagle).isInstanceOf(Eagle.class);
        assertThat(loadedEagle.get(Bird.WINGSPAN)).isEqualTo(200L);
    }

    @Test
    @DisplayName("루트 쿼리는 계층 전체를 반환한다")
    void rootQueryReturnsWholeHierarchy() {
        // When
        List<Model> animals = Animal.SCHEMA.query().orderBy(Animal.NAME.asc()).run().toList();

        // Then
        assertThat(names(animals)).containsExactly("Alice", "Garfield", "Sam");
        assertThat(animals.get(0)).isInstanceOf(Human.class);
        assertThat(animals.get(1)).isInstanceOf(Cat.class);
        assertThat(animals.get(2)).isInstanceOf(Eagle.class);
    }

    @Test
    @DisplayName("중간 모델 쿼리는 그 모델과 하위 모델만 반환한다")
    void intermediateQueryReturnsSubtree() {
        // When
        List<Model> mammals = Mammal.SCHEMA.query().orderBy(Animal.NAME.asc()).run().toList();
        List<Model> birds = Bird.SCHEMA.query().run().toList();

        // Then
        assertThat(names(mammals)).containsExactly("Alice", "Garfield");
        assertThat(birds).hasSize(1).allMatch(Eagle.class::isInstance);
    }

    @Test
    @DisplayName("말단 모델 쿼리는 그 모델만 반환한다")
    void leafQueryReturnsOnlyLeaf() {
        assertThat(names(Cat.SCHEMA.query().run().toList())).containsExactly("Garfield");
        assertThat(Eagle.SCHEMA.query().count()).isEqualTo(1);
    }

    @Test
    @DisplayName("재정의된 속성 기본값이 하위 모델에 적용된다")
    void overriddenDefaultsApply() {
        // When
        List<Model> furry = Mammal.SCHEMA.query().where(Mammal.HAS_FUR.eq(true)).run().toList();

        // Then
        assertThat(human.get(Human.HAS_FUR)).isFalse();
        assertThat(cat.get(Mammal.HAS_FUR)).isTrue();
        assertThat(names(furry)).containsExactly("Garfield");
    }
}
