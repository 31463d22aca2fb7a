package com.ryuqq.kindstore.core.fixture;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.IntegerProperty;

public class Dimensions extends Model {

    public static final IntegerProperty WIDTH = IntegerProperty.builder("width").indexed().build();
    public static final IntegerProperty HEIGHT = IntegerProperty.builder("height").optional().build();

    public static final ModelSchema<Dimensions> SCHEMA = ModelSchema.builder(Dimensions.class, Dimensions::new)
        .properties(WIDTH, HEIGHT)
        .register();

    public static Dimensions of(long width, Long height) {
        Dimensions dimensions = new Dimensions();
        dimensions.set(WIDTH, width);
        dimensions.set(HEIGHT, height);
        return dimensions;
    }
}
