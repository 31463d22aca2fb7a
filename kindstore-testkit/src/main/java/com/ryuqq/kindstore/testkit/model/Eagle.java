package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.ModelSchema;

public class Eagle extends Bird {

    public static final ModelSchema<Eagle> SCHEMA = ModelSchema.builder(Eagle.class, Eagle::new)
        .extending(Bird.SCHEMA)
        .register();
}
