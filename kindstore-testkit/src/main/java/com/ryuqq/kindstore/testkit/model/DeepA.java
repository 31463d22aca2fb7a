package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;

/**
 * 여러 단계로 중첩된 내장 모델: DeepA → DeepB → DeepC → DeepD.
 */
public class DeepA extends Model {

    public static final EmbedProperty<DeepB> CHILD = EmbedProperty.builder("child", DeepB.class).build();

    public static final ModelSchema<DeepA> SCHEMA = ModelSchema.builder(DeepA.class, DeepA::new)
        .property(CHILD)
        .register();

    public static DeepA of(long x) {
        DeepD d = new DeepD();
        d.set(DeepD.X, x);
        DeepC c = new DeepC();
        c.set(DeepC.CHILD, d);
        DeepB b = new DeepB();
        b.set(DeepB.CHILD, c);
        DeepA a = new DeepA();
        a.set(CHILD, b);
        return a;
    }
}
