package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.BoolProperty;

/**
 * 상위 모델의 속성을 재정의하는 다형성 자식.
 */
public class Human extends Mammal {

    public static final BoolProperty HAS_FUR = BoolProperty.builder("has_fur").indexed().defaultValue(false).build();

    public static final ModelSchema<Human> SCHEMA = ModelSchema.builder(Human.class, Human::new)
        .extending(Mammal.SCHEMA)
        .property(HAS_FUR)
        .register();
}
