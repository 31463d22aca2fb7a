package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.IndexCondition;
import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.ModelRegistry;
import com.ryuqq.kindstore.core.model.ModelSchema;
import com.ryuqq.kindstore.core.model.Property;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;

/**
 * 다른 모델을 엔티티 안에 내장하는 속성.
 *
 * <p>내장 모델의 필드는 {@code <속성 이름>.<필드 이름>} 형태의 점 표기 wire 필드로 펼쳐집니다.
 * 내장이 중첩되면 접두사도 중첩됩니다 ({@code child.child.x}).</p>
 *
 * <p><strong>repeated 내장:</strong> 열(column) 단위로 저장됩니다. 각 wire 필드는 원소 순서대로
 * 값을 담은 리스트이며, 모든 열의 길이가 같아야 합니다.</p>
 *
 * <pre>
 * variations = [Variation(weight=10), Variation(weight=20)]
 *   → "variations.weight" = [10, 20]
 * </pre>
 *
 * <p>name, defaultValue, indexed, indexedIf 옵션은 지원하지 않습니다. 내장 모델 필드의
 * 인덱스 여부는 내장 모델의 선언을 따르며, {@link #field(Property)}로 필터/정렬에 사용할 수 있습니다.</p>
 *
 * @param <M> 내장 모델 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class EmbedProperty<M extends Model> extends Property<M> {

    private final Class<M> modelClass;

    private EmbedProperty(Builder<M> builder, Class<M> modelClass) {
        super(builder, modelClass, List.of());
        this.modelClass = modelClass;
    }

    private EmbedProperty(EmbedProperty<M> source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.modelClass = source.modelClass;
    }

    @Override
    public EmbedProperty<M> withPrefix(String entityPrefix, String modelPrefix) {
        return new EmbedProperty<>(this, entityPrefix, modelPrefix);
    }

    /**
     * @param name 모델 속성 이름 (wire 필드 접두사로도 사용)
     * @param modelClass 내장 모델 클래스
     * @param <M> 내장 모델 타입
     * @return 빌더
     */
    public static <M extends Model> Builder<M> builder(String name, Class<M> modelClass) {
        return new Builder<>(name, modelClass);
    }

    public Class<M> modelClass() {
        return modelClass;
    }

    /**
     * 내장 모델의 스키마. 모델 클래스가 아직 초기화되지 않았다면 초기화합니다.
     */
    public ModelSchema<?> embeddedSchema() {
        return ModelRegistry.schemaOf(modelClass);
    }

    private String prefix() {
        return nameOnEntity() + ".";
    }

    // ========== Store / Load ==========

    @Override
    public void store(Model entity, BiConsumer<String, Object> sink) {
        Object value = read(entity);
        if (value == null) {
            if (!isOptional()) {
                throw new IllegalStateException("Property " + nameOnModel() + " requires a value.");
            }
            return;
        }

        if (value instanceof List<?> elements) {
            storeColumns(elements, sink);
            return;
        }

        for (Map.Entry<String, Object> field : ((Model) value).toEntityData().entrySet()) {
            sink.accept(prefix() + field.getKey(), field.getValue());
        }
    }

    private void storeColumns(List<?> elements, BiConsumer<String, Object> sink) {
        Map<String, List<Object>> columns = new LinkedHashMap<>();
        for (Object element : elements) {
            for (Map.Entry<String, Object> field : ((Model) element).toEntityData().entrySet()) {
                columns.computeIfAbsent(field.getKey(), name -> new ArrayList<>()).add(field.getValue());
            }
        }
        for (List<Object> column : columns.values()) {
            if (column.size() != elements.size()) {
                throw new IllegalStateException(
                    "Repeated properties for " + nameOnModel() + " have different lengths.");
            }
        }
        for (Map.Entry<String, List<Object>> column : columns.entrySet()) {
            sink.accept(prefix() + column.getKey(), column.getValue());
        }
    }

    @Override
    public void load(Model entity, Map<String, Object> data) {
        String prefix = prefix();
        Map<String, Object> embedded = new LinkedHashMap<>();
        for (Map.Entry<String, Object> field : data.entrySet()) {
            if (field.getKey().startsWith(prefix)) {
                embedded.put(field.getKey().substring(prefix.length()), field.getValue());
            }
        }

        if (isRepeated()) {
            if (!embedded.isEmpty()) {
                rawData(entity).put(nameOnEntity(), loadColumns(embedded));
            }
            return;
        }

        if (embedded.isEmpty() && isOptional()) {
            rawData(entity).put(nameOnEntity(), null);
            return;
        }
        rawData(entity).put(nameOnEntity(), loadOne(embedded));
    }

    private List<Model> loadColumns(Map<String, Object> columns) {
        int size = -1;
        for (Object column : columns.values()) {
            if (!(column instanceof List<?> values) || (size >= 0 && size != values.size())) {
                throw new IllegalStateException(
                    "Repeated properties for " + nameOnModel() + " have different lengths.");
            }
            size = values.size();
        }

        List<Map<String, Object>> rows = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            rows.add(new LinkedHashMap<>());
        }
        for (Map.Entry<String, Object> column : columns.entrySet()) {
            List<?> values = (List<?>) column.getValue();
            for (int i = 0; i < size; i++) {
                rows.get(i).put(column.getKey(), values.get(i));
            }
        }

        List<Model> elements = new ArrayList<>(size);
        for (Map<String, Object> row : rows) {
            elements.add(loadOne(row));
        }
        return elements;
    }

    private Model loadOne(Map<String, Object> data) {
        ModelSchema<?> schema = embeddedSchema();
        return schema.load(schema.newInstance().getKey(), data);
    }

    @Override
    public List<String> unindexedNames(Model entity) {
        Object value = read(entity);
        if (value == null) {
            return List.of();
        }

        Set<String> names = new LinkedHashSet<>();
        if (value instanceof List<?> elements) {
            for (Object element : elements) {
                names.addAll(((Model) element).unindexedProperties());
            }
        } else {
            names.addAll(((Model) value).unindexedProperties());
        }

        List<String> prefixed = new ArrayList<>(names.size());
        for (String name : names) {
            prefixed.add(prefix() + name);
        }
        return prefixed;
    }

    // ========== Field views ==========

    /**
     * 내장 모델 속성의 접두사가 붙은 뷰. 필터와 정렬에 사용합니다.
     *
     * <pre>{@code
     * Outer.SCHEMA.query().where(Outer.NESTED.field(Nested.Z).eq(1L));
     * }</pre>
     *
     * @param property 내장 모델의 속성
     * @param <T> 값 타입
     * @return wire 이름이 {@code <이 속성>.<필드>}인 속성 뷰
     * @throws IllegalArgumentException 내장 모델의 속성이 아닌 경우
     */
    public <T> Property<T> field(Property<T> property) {
        checkEmbeddedProperty(property);
        return property.withPrefix(prefix(), nameOnModel() + ".");
    }

    /**
     * 중첩된 내장 속성의 뷰. 연쇄 호출로 깊은 필드에 접근합니다.
     *
     * @param property 내장 모델의 내장 속성
     * @param <E> 중첩 내장 모델 타입
     * @return 접두사가 붙은 내장 속성 뷰
     */
    public <E extends Model> EmbedProperty<E> field(EmbedProperty<E> property) {
        checkEmbeddedProperty(property);
        return property.withPrefix(prefix(), nameOnModel() + ".");
    }

    private void checkEmbeddedProperty(Property<?> property) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (embeddedSchema().property(property.nameOnModel()) != property) {
            throw new IllegalArgumentException(
                property.nameOnModel() + " is not a property of " + embeddedSchema().modelName() + ".");
        }
    }

    /**
     * {@link EmbedProperty} 빌더. optional, repeated만 지원합니다.
     *
     * @param <M> 내장 모델 타입
     */
    public static final class Builder<M extends Model> extends Property.Builder<EmbedProperty<M>, Builder<M>> {

        private static final String UNSUPPORTED =
            "EmbedProperty does not support name, default, indexed or indexedIf.";

        private final Class<M> modelClass;

        private Builder(String name, Class<M> modelClass) {
            super(name);
            if (modelClass == null) {
                throw new IllegalArgumentException("modelClass cannot be null");
            }
            this.modelClass = modelClass;
        }

        @Override
        public Builder<M> name(String entityName) {
            throw new IllegalArgumentException(UNSUPPORTED);
        }

        @Override
        public Builder<M> defaultValue(Object defaultValue) {
            throw new IllegalArgumentException(UNSUPPORTED);
        }

        @Override
        public Builder<M> indexed(boolean indexed) {
            throw new IllegalArgumentException(UNSUPPORTED);
        }

        @Override
        public Builder<M> indexedIf(IndexCondition condition) {
            throw new IllegalArgumentException(UNSUPPORTED);
        }

        @Override
        protected Builder<M> self() {
            return this;
        }

        @Override
        protected EmbedProperty<M> create() {
            return new EmbedProperty<>(this, modelClass);
        }
    }
}
