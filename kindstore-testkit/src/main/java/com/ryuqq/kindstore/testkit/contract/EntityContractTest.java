package com.ryuqq.kindstore.testkit.contract;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.model.Entities;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.testkit.model.BankAccount;
import com.ryuqq.kindstore.testkit.model.Person;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Entity get/put/delete contract.
 *
 * <p>모든 어댑터는 다음을 보장해야 합니다:</p>
 * <ul>
 *   <li>partial Key를 가진 엔티티는 저장 시 id가 할당된다</li>
 *   <li>getMulti 결과는 요청 Key 순서와 정렬되며, 없는 엔티티는 null</li>
 *   <li>삭제된 엔티티는 다시 조회되지 않는다</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class EntityContractTest extends AbstractAdapterContractTest {

    @Test
    @DisplayName("저장 시 partial Key에 id가 할당되고 같은 엔티티로 조회된다")
    void putAssignsIdAndGetReturnsEqualEntity() {
        // Given
        Person person = Person.of("alice@example.com", 30);
        assertThat(person.getKey().isPartial()).isTrue();

        // When
        Person stored = Entities.put(person);
        Person loaded = Entities.get(stored.getKey(), Person.class);

        // Then
        assertThat(stored.getKey().isPartial()).isFalse();
        assertThat(stored.getKey().intId()).isNotNull();
        assertThat(loaded).isEqualTo(stored);
        assertThat(loaded.getEmail()).isEqualTo("alice@example.com");
        assertThat(loaded.getAge()).isEqualTo(30L);
    }

    @Test
    @DisplayName("autoNowAdd 속성은 저장 시 UTC 시각으로 채워진다")
    void autoNowAddIsStampedInUtc() {
        // Given
        Person person = Person.of("bob@example.com");

        // When
        person.put();
        Person loaded = Entities.get(person.getKey(), Person.class);

        // Then
        assertThat(person.getCreatedAt()).isNotNull();
        assertThat(loaded.getCreatedAt().getOffset()).isEqualTo(ZoneOffset.UTC);
        assertThat(loaded.getCreatedAt().toInstant()).isEqualTo(person.getCreatedAt().toInstant());
    }

    @Test
    @DisplayName("존재하지 않는 Key는 null을 반환한다")
    void getMissingReturnsNull() {
        assertThat(Entities.get(Key.of("Person", 424242L))).isNull();
    }

    @Test
    @DisplayName("getMulti 결과는 요청 순서를 따르고 없는 Key 자리에 null이 들어간다")
    void getMultiIsAlignedWithRequestedKeys() {
        // Given
        List<Person> people = putAll(Person.of("a@example.com"), Person.of("b@example.com"));
        Key missing = Key.of("Person", "nobody");

        // When
        List<Model> loaded = Entities.getMulti(Arrays.asList(
            people.get(1).getKey(), missing, people.get(0).getKey()
        ));

        // Then
        assertThat(loaded).hasSize(3);
        assertThat(loaded.get(0)).isEqualTo(people.get(1));
        assertThat(loaded.get(1)).isNull();
        assertThat(loaded.get(2)).isEqualTo(people.get(0));
    }

    @Test
    @DisplayName("name Key로 저장하면 같은 name으로 조회된다")
    void namedKeysRoundTrip() {
        // Given
        Person person = Person.of("named@example.com");
        person.setKey(Key.of("Person", "named"));

        // When
        person.put();

        // Then
        Person loaded = Entities.get(Person.SCHEMA, "named");
        assertThat(loaded).isNotNull();
        assertThat(loaded.getKey().strId()).isEqualTo("named");
    }

    @Test
    @DisplayName("같은 Key로 다시 저장하면 덮어쓴다")
    void putOverwritesExistingEntity() {
        // Given
        BankAccount account = Entities.put(BankAccount.withBalance(10));

        // When
        account.deposit(15).put();

        // Then
        BankAccount loaded = Entities.get(account.getKey(), BankAccount.class);
        assertThat(loaded.getBalance()).isEqualTo(25L);
    }

    @Test
    @DisplayName("삭제 후에는 조회되지 않는다")
    void deleteRemovesEntity() {
        // Given
        List<Person> people = putAll(Person.of("x@example.com"), Person.of("y@example.com"));

        // When
        people.get(0).delete();

        // Then
        assertNotStored(people.get(0).getKey());
        assertStored(people.get(1).getKey());
    }

    @Test
    @DisplayName("여러 Key를 한 번에 삭제한다")
    void deleteMultiRemovesAll() {
        // Given
        List<Person> people = putAll(Person.of("p@example.com"), Person.of("q@example.com"));

        // When
        Entities.deleteMulti(keysOf(people));

        // Then
        assertThat(Entities.getMulti(keysOf(people))).containsOnlyNulls();
    }

    @Test
    @DisplayName("필수 속성이 없으면 저장이 거부되고 Key도 할당되지 않는다")
    void putRejectsMissingRequiredProperty() {
        // Given
        Person person = new Person();

        // When & Then
        assertThatThrownBy(person::put).isInstanceOf(IllegalStateException.class);
        assertThat(person.getKey().isPartial()).isTrue();
    }

    @Test
    @DisplayName("partial Key로는 조회하거나 삭제할 수 없다")
    void partialKeysAreRejectedForGetAndDelete() {
        assertThatThrownBy(() -> Entities.get(Key.of("Person")))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> Entities.delete(Key.of("Person")))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("부모 Key를 가진 엔티티를 저장하고 조회한다")
    void childKeysRoundTrip() {
        // Given
        BankAccount parent = Entities.put(BankAccount.withBalance(1));
        Person child = Person.of("child@example.com");
        child.setKey(Key.of("Person", null, parent.getKey()));

        // When
        child.put();

        // Then
        assertThat(child.getKey().getParent()).isEqualTo(parent.getKey());
        assertThat(Entities.get(child.getKey(), Person.class)).isEqualTo(child);
    }
}
