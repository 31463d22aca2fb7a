package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.IntegerProperty;
import com.ryuqq.kindstore.core.property.StringProperty;

/**
 * {@link Product}에 반복 내장되는 모델.
 */
public class Variation extends Model {

    public static final StringProperty NAME = StringProperty.builder("name").indexed().build();
    public static final IntegerProperty WEIGHT = IntegerProperty.builder("weight").indexed().build();

    public static final ModelSchema<Variation> SCHEMA = ModelSchema.builder(Variation.class, Variation::new)
        .properties(NAME, WEIGHT)
        .register();

    public static Variation of(String name, long weight) {
        Variation variation = new Variation();
        variation.set(NAME, name);
        variation.set(WEIGHT, weight);
        return variation;
    }
}
