package com.ryuqq.kindstore.core.model;

import com.ryuqq.kindstore.core.fixture.Circle;
import com.ryuqq.kindstore.core.fixture.Disc;
import com.ryuqq.kindstore.core.fixture.Gadget;
import com.ryuqq.kindstore.core.fixture.Shape;
import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.property.IntegerProperty;
import com.ryuqq.kindstore.core.property.StringProperty;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ModelSchema / ModelRegistry 테스트.
 */
class ModelSchemaTest {

    static class Impostor extends Model {
    }

    static class Clash extends Model {
    }

    static class Reserved extends Model {
    }

    static class Unrelated extends Model {
    }

    static class Twice extends Model {
    }

    @Nested
    @DisplayName("등록")
    class Registration {

        @Test
        @DisplayName("모델 이름과 클래스로 스키마를 조회할 수 있다")
        void lookup() {
            assertThat(ModelRegistry.schemaOf(Gadget.class)).isSameAs(Gadget.SCHEMA);
            assertThat(ModelRegistry.lookup("Gadget")).isSameAs(Gadget.SCHEMA);
            assertThat(ModelRegistry.isRegistered("Gadget")).isTrue();
        }

        @Test
        @DisplayName("등록되지 않은 kind 조회는 실패한다")
        void unknownKind() {
            assertThatThrownBy(() -> ModelRegistry.lookup("NoSuchKind"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Model for kind 'NoSuchKind' not found.");
        }

        @Test
        @DisplayName("같은 kind를 두 번 등록할 수 없다")
        void duplicateKind() {
            // Given
            assertThat(Gadget.SCHEMA).isNotNull();

            // When & Then
            assertThatThrownBy(() -> ModelSchema.builder(Impostor.class, Impostor::new).kind("Gadget").register())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Gadget");
        }

        @Test
        @DisplayName("같은 모델 클래스를 다른 kind로 다시 등록할 수 없다")
        void duplicateClass() {
            ModelSchema.builder(Twice.class, Twice::new).kind("TwiceFirst").register();

            assertThatThrownBy(() -> ModelSchema.builder(Twice.class, Twice::new).kind("TwiceSecond").register())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is already registered");
            assertThat(ModelRegistry.isRegistered("TwiceSecond")).isFalse();
        }

        @Test
        @DisplayName("두 속성이 같은 wire 필드를 쓸 수 없다")
        void duplicateEntityNames() {
            assertThatThrownBy(() -> ModelSchema.builder(Clash.class, Clash::new)
                .properties(
                    StringProperty.builder("first").name("x").build(),
                    IntegerProperty.builder("second").name("x").build())
                .register())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("share the entity field x");
        }

        @Test
        @DisplayName("예약된 필드 이름은 사용할 수 없다")
        void reservedFieldName() {
            assertThatThrownBy(() -> ModelSchema.builder(Reserved.class, Reserved::new)
                .property(StringProperty.builder("kinds").name(Model.KINDS_FIELD).build())
                .register())
                .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("하위 클래스가 아닌 모델은 확장할 수 없다")
        void extendingRequiresSubclass() {
            assertThatThrownBy(() -> ModelSchema.builder(Unrelated.class, Unrelated::new).extending(Gadget.SCHEMA))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("is not a subclass of Gadget");
        }
    }

    @Nested
    @DisplayName("다형성")
    class Polymorphism {

        @Test
        @DisplayName("자식 모델은 루트 kind를 공유하고 kindChain을 가진다")
        void kindChain() {
            assertThat(Disc.SCHEMA.kind()).isEqualTo("Shape");
            assertThat(Disc.SCHEMA.modelName()).isEqualTo("Disc");
            assertThat(Disc.SCHEMA.kindChain()).containsExactly("Disc", "Circle", "Shape");
            assertThat(Shape.SCHEMA.isRoot()).isTrue();
            assertThat(Circle.SCHEMA.isChild()).isTrue();
            assertThat(Gadget.SCHEMA.isPolymorphic()).isFalse();
        }

        @Test
        @DisplayName("자식 모델은 상위 속성을 상속한다")
        void inheritsProperties() {
            assertThat(Disc.SCHEMA.property("color")).isSameAs(Shape.COLOR);
            assertThat(Disc.SCHEMA.property("radius")).isSameAs(Circle.RADIUS);
        }

        @Test
        @DisplayName("저장 데이터에 kindChain이 기록된다")
        void storesKindChain() {
            Circle circle = new Circle();
            circle.set(Circle.RADIUS, 2.0);

            Map<String, Object> data = circle.toEntityData();

            assertThat(data).containsEntry(Model.KINDS_FIELD, List.of("Circle", "Shape"));
            assertThat(circle.getKey().getKind()).isEqualTo("Shape");
        }

        @Test
        @DisplayName("루트 스키마로 로드해도 가장 구체적인 클래스로 복원된다")
        void loadsMostSpecificClass() {
            // Given
            Disc disc = new Disc();
            disc.set(Circle.RADIUS, 1.5);
            Map<String, Object> data = disc.toEntityData();

            // When
            Model loaded = Shape.SCHEMA.load(Key.of("Shape", 7L), data);

            // Then
            assertThat(loaded).isInstanceOf(Disc.class);
            assertThat(loaded.get(Circle.RADIUS)).isEqualTo(1.5);
            assertThat(loaded.getKey()).isEqualTo(Key.of("Shape", 7L));
        }

        @Test
        @DisplayName("kindChain이 없는 데이터는 스키마 자신의 클래스로 로드된다")
        void loadsWithoutChain() {
            Model loaded = Shape.SCHEMA.load(Key.of("Shape", 1L), new HashMap<>());

            assertThat(loaded).isExactlyInstanceOf(Shape.class);
        }
    }

    @Nested
    @DisplayName("모델 인스턴스")
    class Instances {

        @Test
        @DisplayName("새 인스턴스는 모델 kind의 partial Key를 가진다")
        void newInstanceHasPartialKey() {
            Gadget gadget = Gadget.SCHEMA.newInstance();

            assertThat(gadget.getKey().isPartial()).isTrue();
            assertThat(gadget.getKey().getKind()).isEqualTo("Gadget");
        }

        @Test
        @DisplayName("같은 Key와 같은 값을 가진 엔티티는 동등하다")
        void equality() {
            Gadget first = Gadget.named("lamp");
            Gadget second = Gadget.named("lamp");
            Gadget third = Gadget.named("desk");

            assertThat(first).isEqualTo(second).hasSameHashCodeAs(second);
            assertThat(first).isNotEqualTo(third);
            first.setKey(Key.of("Gadget", 1L));
            assertThat(first).isNotEqualTo(second);
        }

        @Test
        @DisplayName("repeated 속성의 byte 배열은 내용으로 비교된다")
        void valuesEqual() {
            assertThat(Model.valuesEqual(List.of(new byte[]{1}), List.of(new byte[]{1}))).isTrue();
            assertThat(Model.valuesEqual(List.of(1L), List.of(1L, 2L))).isFalse();
        }
    }
}
