package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.StringProperty;

/**
 * 다형성 계층의 루트.
 *
 * <pre>
 * Animal
 * ├── Mammal
 * │   ├── Cat
 * │   └── Human
 * └── Bird
 *     └── Eagle
 * </pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public class Animal extends Model {

    public static final StringProperty NAME = StringProperty.builder("name").indexed().build();

    public static final ModelSchema<Animal> SCHEMA = ModelSchema.builder(Animal.class, Animal::new)
        .polymorphic()
        .property(NAME)
        .register();

    public String getName() {
        return get(NAME);
    }

    public static <A extends Animal> A named(A animal, String name) {
        animal.set(NAME, name);
        return animal;
    }
}
