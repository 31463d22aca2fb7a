package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;

public class DeepB extends Model {

    public static final EmbedProperty<DeepC> CHILD = EmbedProperty.builder("child", DeepC.class).build();

    public static final ModelSchema<DeepB> SCHEMA = ModelSchema.builder(DeepB.class, DeepB::new)
        .property(CHILD)
        .register();
}
