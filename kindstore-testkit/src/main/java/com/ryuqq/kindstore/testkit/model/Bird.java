package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.IntegerProperty;

public class Bird extends Animal {

    public static final IntegerProperty WINGSPAN = IntegerProperty.builder("wingspan").indexed().optional().build();

    public static final ModelSchema<Bird> SCHEMA = ModelSchema.builder(Bird.class, Bird::new)
        .extending(Animal.SCHEMA)
        .property(WINGSPAN)
        .register();
}
