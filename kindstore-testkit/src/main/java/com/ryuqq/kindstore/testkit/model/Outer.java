package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;
import com.ryuqq.kindstore.core.property.FloatProperty;

/**
 * 단일 내장 모델을 가진 모델.
 *
 * <p>wire 필드: {@code x}, {@code nested.y}, {@code nested.z}</p>
 */
public class Outer extends Model {

    public static final FloatProperty X = FloatProperty.builder("x").indexed().build();
    public static final EmbedProperty<Nested> NESTED = EmbedProperty.builder("nested", Nested.class).build();

    public static final ModelSchema<Outer> SCHEMA = ModelSchema.builder(Outer.class, Outer::new)
        .properties(X, NESTED)
        .register();

    public static Outer of(double x, Nested nested) {
        Outer outer = new Outer();
        outer.set(X, x);
        outer.set(NESTED, nested);
        return outer;
    }
}
