package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.DateTimeProperty;
import com.ryuqq.kindstore.core.property.IntegerProperty;
import com.ryuqq.kindstore.core.property.StringProperty;

import java.time.ZonedDateTime;

/**
 * 기본 CRUD와 쿼리 테스트용 모델.
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class Person extends Model {

    public static final StringProperty EMAIL = StringProperty.builder("email").indexed().build();
    public static final StringProperty FIRST_NAME = StringProperty.builder("first_name").optional().build();
    public static final StringProperty LAST_NAME = StringProperty.builder("last_name").optional().build();
    public static final IntegerProperty AGE = IntegerProperty.builder("age").indexed().optional().build();
    public static final DateTimeProperty CREATED_AT = DateTimeProperty.builder("created_at").autoNowAdd().build();

    public static final ModelSchema<Person> SCHEMA = ModelSchema.builder(Person.class, Person::new)
        .properties(EMAIL, FIRST_NAME, LAST_NAME, AGE, CREATED_AT)
        .register();

    public static Person of(String email) {
        Person person = new Person();
        person.set(EMAIL, email);
        return person;
    }

    public static Person of(String email, long age) {
        Person person = of(email);
        person.set(AGE, age);
        return person;
    }

    public String getEmail() {
        return get(EMAIL);
    }

    public Long getAge() {
        return get(AGE);
    }

    public ZonedDateTime getCreatedAt() {
        return get(CREATED_AT);
    }
}
