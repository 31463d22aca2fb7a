package com.ryuqq.kindstore.core.property;

import com.ryuqq.kindstore.core.model.Model;
import com.ryuqq.kindstore.core.model.Property;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 엔티티 상태로부터 계산되는 속성.
 *
 * <p>처음 조회될 때 계산되어 엔티티에 캐시되며, {@link Model#unset(Property)}로 캐시를 지우면
 * 다음 조회 시 다시 계산됩니다. 할당할 수 없고 저장된 값은 로드하지 않습니다
 * (로드된 엔티티에서 다시 계산).</p>
 *
 * <p>다른 속성과 달리 기본값이 indexed, optional 입니다.</p>
 *
 * <pre>{@code
 * public static final ComputedProperty<Long> NAME_LENGTH =
 *     ComputedProperty.builder("name_length", Long.class, e -> (long) e.get(NAME).length()).build();
 * }</pre>
 *
 * @param <T> 계산 값 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class ComputedProperty<T> extends Property<T> {

    private final Function<? super Model, ? extends T> function;

    private ComputedProperty(Builder<T> builder, Class<T> valueType, Function<? super Model, ? extends T> function) {
        super(builder, valueType, List.of());
        this.function = function;
    }

    private ComputedProperty(ComputedProperty<T> source, String entityPrefix, String modelPrefix) {
        super(source, entityPrefix, modelPrefix);
        this.function = source.function;
    }

    @Override
    public ComputedProperty<T> withPrefix(String entityPrefix, String modelPrefix) {
        return new ComputedProperty<>(this, entityPrefix, modelPrefix);
    }

    /**
     * @param name 모델 속성 이름
     * @param valueType 계산 값 타입
     * @param function 계산 함수
     * @param <T> 계산 값 타입
     * @return 빌더
     */
    public static <T> Builder<T> builder(String name, Class<T> valueType,
                                         Function<? super Model, ? extends T> function) {
        return new Builder<>(name, valueType, function);
    }

    @Override
    protected Object read(Model entity) {
        Map<String, Object> data = rawData(entity);
        if (data.containsKey(nameOnEntity())) {
            return data.get(nameOnEntity());
        }
        Object value = function.apply(entity);
        data.put(nameOnEntity(), value);
        return value;
    }

    @Override
    protected void write(Model entity, Object value) {
        throw new UnsupportedOperationException("Can't set computed property " + nameOnModel() + ".");
    }

    @Override
    public Object prepareToLoad(Model entity, Object value) {
        return SKIP;
    }

    public static final class Builder<T> extends Property.Builder<ComputedProperty<T>, Builder<T>> {

        private final Class<T> valueType;
        private final Function<? super Model, ? extends T> function;

        private Builder(String name, Class<T> valueType, Function<? super Model, ? extends T> function) {
            super(name);
            if (valueType == null) {
                throw new IllegalArgumentException("valueType cannot be null");
            }
            if (function == null) {
                throw new IllegalArgumentException("function cannot be null");
            }
            this.valueType = valueType;
            this.function = function;
            this.indexed = true;
            this.optional = true;
        }

        @Override
        protected Builder<T> self() {
            return this;
        }

        @Override
        protected ComputedProperty<T> create() {
            return new ComputedProperty<>(this, valueType, function);
        }
    }
}
