package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;

public class DeepC extends Model {

    public static final EmbedProperty<DeepD> CHILD = EmbedProperty.builder("child", DeepD.class).build();

    public static final ModelSchema<DeepC> SCHEMA = ModelSchema.builder(DeepC.class, DeepC::new)
        .property(CHILD)
        .register();
}
