package com.ryuqq.kindstore.core.fixture;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;
import com.ryuqq.kindstore.core.property.StringProperty;

public class Crate extends Model {

    public static final StringProperty LABEL = StringProperty.builder("label").indexed().build();
    public static final EmbedProperty<Dimensions> SIZE =
        EmbedProperty.builder("size", Dimensions.class).optional().build();
    public static final EmbedProperty<Dimensions> COMPARTMENTS =
        EmbedProperty.builder("compartments", Dimensions.class).repeated().build();

    public static final ModelSchema<Crate> SCHEMA = ModelSchema.builder(Crate.class, Crate::new)
        .properties(LABEL, SIZE, COMPARTMENTS)
        .register();

    public static Crate labeled(String label) {
        Crate crate = new Crate();
        crate.set(LABEL, label);
        return crate;
    }
}
