package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.IntegerProperty;

public class DeepD extends Model {

    public static final IntegerProperty X = IntegerProperty.builder("x").build();

    public static final ModelSchema<DeepD> SCHEMA = ModelSchema.builder(DeepD.class, DeepD::new)
        .property(X)
        .register();
}
