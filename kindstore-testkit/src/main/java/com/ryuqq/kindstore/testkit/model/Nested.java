package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.FloatProperty;

/**
 * {@link Outer}에 내장되는 모델.
 */
public class Nested extends Model {

    public static final FloatProperty Y = FloatProperty.builder("y").build();
    public static final FloatProperty Z = FloatProperty.builder("z").indexed().build();

    public static final ModelSchema<Nested> SCHEMA = ModelSchema.builder(Nested.class, Nested::new)
        .properties(Y, Z)
        .register();

    public static Nested of(double y, double z) {
        Nested nested = new Nested();
        nested.set(Y, y);
        nested.set(Z, z);
        return nested;
    }
}
