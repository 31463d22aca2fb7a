package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.ModelSchema;

public class Cat extends Mammal {

    public static final ModelSchema<Cat> SCHEMA = ModelSchema.builder(Cat.class, Cat::new)
        .extending(Mammal.SCHEMA)
        .register();
}
