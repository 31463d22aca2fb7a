package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.BoolProperty;

public class Mammal extends Animal {

    public static final BoolProperty HAS_FUR = BoolProperty.builder("has_fur").indexed().defaultValue(true).build();

    public static final ModelSchema<Mammal> SCHEMA = ModelSchema.builder(Mammal.class, Mammal::new)
        .extending(Animal.SCHEMA)
        .property(HAS_FUR)
        .register();
}
