package com.ryuqq.kindstore.testkit.model;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.property.EmbedProperty;
import com.ryuqq.kindstore.core.property.StringProperty;

import java.util.List;

/**
 * 반복 내장 모델을 가진 모델. 내장 필드는 열 단위 리스트로 저장됩니다.
 */
public class Product extends Model {

    public static final StringProperty TITLE = StringProperty.builder("title").indexed().build();
    public static final EmbedProperty<Variation> VARIATIONS =
        EmbedProperty.builder("variations", Variation.class).repeated().build();

    public static final ModelSchema<Product> SCHEMA = ModelSchema.builder(Product.class, Product::new)
        .properties(TITLE, VARIATIONS)
        .register();

    public static Product of(String title, List<Variation> variations) {
        Product product = new Product();
        product.set(TITLE, title);
        product.setAll(VARIATIONS, variations);
        return product;
    }
}
