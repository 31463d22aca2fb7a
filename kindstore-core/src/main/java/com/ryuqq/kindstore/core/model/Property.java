package com.ryuqq.kindstore.core.model;

import com.ryuqq.kindstore.core.codec.ValueCodec;
import com.ryuqq.kindstore.core.query.PropertyFilter;
import com.ryuqq.kindstore.core.query.PropertyOrder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.ListIterator;
import java.util.Map;
import java.util.function.BiConsumer;

/**
 * 모델 속성 디스크립터의 기반 클래스.
 *
 * <p>속성은 모델 클래스의 {@code static final} 필드로 한 번 선언되고,
 * {@link ModelSchema}에 등록되어 엔티티 값의 검증/저장/로드를 담당합니다.</p>
 *
 * <p><strong>생명주기:</strong></p>
 * <ul>
 *   <li>{@link #validate(Object)}: 엔티티에 값을 할당할 때마다 호출</li>
 *   <li>{@link #prepareToStore(Model, Object)}: 저장 직전 선언 순서대로 호출</li>
 *   <li>{@link #prepareToLoad(Model, Object)}: 저장된 필드로 엔티티를 복원할 때 호출,
 *       {@link #SKIP}을 반환하면 할당하지 않음</li>
 * </ul>
 *
 * <p><strong>공통 옵션:</strong></p>
 * <ul>
 *   <li>name: 엔티티(wire) 필드 이름, 기본값은 모델 속성 이름</li>
 *   <li>defaultValue: 값이 없을 때 반환되는 기본값</li>
 *   <li>indexed / indexedIf: 인덱스 여부 (기본 false), 조건부 인덱스</li>
 *   <li>optional: null 허용 여부 (기본 false)</li>
 *   <li>repeated: 리스트 값 여부 (기본 false)</li>
 * </ul>
 *
 * <p>저장 파이프라인은 {@link ValueCodec} 목록으로 구성되며, 저장 시 앞에서부터,
 * 로드 시 뒤에서부터 적용됩니다. repeated 값은 원소 단위로 변환됩니다.</p>
 *
 * @param <T> 원소 값 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class Property<T> {

    /**
     * {@link #prepareToLoad(Model, Object)}가 반환하면 해당 값을 엔티티에 할당하지 않음.
     */
    public static final Object SKIP = new Object() {
        @Override
        public String toString() {
            return "SKIP";
        }
    };

    private final Class<T> valueType;
    private final List<ValueCodec> codecs;
    private final boolean indexed;
    private final IndexCondition indexedIf;
    private final boolean optional;
    private final boolean repeated;
    private final String nameOnModel;
    private final String nameOnEntity;
    private Object defaultValue;

    /**
     * @param builder 공통 옵션
     * @param valueType 허용되는 원소 타입
     * @param codecs 저장 파이프라인 (선언 순서)
     */
    protected Property(Builder<?, ?> builder, Class<T> valueType, List<ValueCodec> codecs) {
        this.valueType = valueType;
        this.codecs = codecs == null ? List.of() : List.copyOf(codecs);
        this.indexed = builder.indexed || builder.indexedIf != null;
        this.indexedIf = builder.indexedIf;
        this.optional = builder.optional;
        this.repeated = builder.repeated;
        this.nameOnModel = builder.name;
        this.nameOnEntity = builder.entityName != null ? builder.entityName : builder.name;
    }

    /**
     * 이름에 접두사를 붙인 복사 생성자. {@link #withPrefix(String, String)} 구현에서 사용합니다.
     *
     * @param source 원본 속성
     * @param entityPrefix wire 이름 접두사
     * @param modelPrefix 모델 이름 접두사
     */
    protected Property(Property<T> source, String entityPrefix, String modelPrefix) {
        this.valueType = source.valueType;
        this.codecs = source.codecs;
        this.indexed = source.indexed;
        this.indexedIf = source.indexedIf;
        this.optional = source.optional;
        this.repeated = source.repeated;
        this.nameOnModel = modelPrefix + source.nameOnModel;
        this.nameOnEntity = entityPrefix + source.nameOnEntity;
        this.defaultValue = source.defaultValue;
    }

    private void initialize(Object rawDefault) {
        if (isBlob() && indexed) {
            throw new IllegalArgumentException(getClass().getSimpleName() + " properties cannot be indexed.");
        }
        this.defaultValue = rawDefault != null ? validate(rawDefault) : null;
    }

    // ========== Metadata ==========

    public String nameOnModel() {
        return nameOnModel;
    }

    public String nameOnEntity() {
        return nameOnEntity;
    }

    public Object defaultValue() {
        return defaultValue;
    }

    public boolean isIndexed() {
        return indexed;
    }

    public IndexCondition indexedIf() {
        return indexedIf;
    }

    public boolean isOptional() {
        return optional;
    }

    public boolean isRepeated() {
        return repeated;
    }

    public Class<T> valueType() {
        return valueType;
    }

    public List<ValueCodec> codecs() {
        return codecs;
    }

    /**
     * 인덱스할 수 없는 blob 타입 여부.
     *
     * @return blob이면 true
     */
    protected boolean isBlob() {
        return false;
    }

    /**
     * 주어진 엔티티에 대해 이 속성이 인덱스되는지 확인.
     *
     * @param entity 엔티티
     * @return indexed이고 조건이 없거나 조건을 만족하면 true
     */
    public boolean isIndexedFor(Model entity) {
        return indexed && (indexedIf == null || indexedIf.test(entity, this));
    }

    // ========== Validation ==========

    /**
     * 할당할 값 검증.
     *
     * @param value 할당할 값
     * @return 엔티티에 저장될 값 (repeated이면 새 리스트)
     * @throws IllegalArgumentException 타입이 맞지 않거나 필수 속성에 null을 할당한 경우
     */
    public Object validate(Object value) {
        if (value == null) {
            if (optional) {
                return null;
            }
            throw new IllegalArgumentException(
                "Value of type null assigned to " + getClass().getSimpleName() + " property " + nameOnModel + ".");
        }

        if (repeated) {
            if (!(value instanceof Collection<?> values)) {
                throw new IllegalArgumentException(
                    "Value of type " + value.getClass().getSimpleName() + " assigned to repeated "
                        + getClass().getSimpleName() + " property " + nameOnModel + ".");
            }
            List<Object> validated = new ArrayList<>(values.size());
            for (Object element : values) {
                if (element == null) {
                    throw new IllegalArgumentException(
                        "Repeated property " + nameOnModel + " cannot contain null values.");
                }
                validated.add(validateElement(element));
            }
            return validated;
        }

        return validateElement(value);
    }

    /**
     * 단일 원소 검증 및 정규화.
     *
     * @param value non-null 값
     * @return 정규화된 값
     * @throws IllegalArgumentException 타입이 맞지 않는 경우
     */
    protected Object validateElement(Object value) {
        if (!valueType.isInstance(value)) {
            throw new IllegalArgumentException(
                "Value of type " + value.getClass().getSimpleName() + " assigned to "
                    + getClass().getSimpleName() + " property " + nameOnModel + ".");
        }
        return value;
    }

    // ========== Store / Load ==========

    /**
     * 저장할 wire 값 준비.
     *
     * @param entity 값이 속한 엔티티 (nullable)
     * @param value 모델 값
     * @return wire 값
     * @throws IllegalStateException 필수 속성에 값이 없는 경우
     */
    public Object prepareToStore(Model entity, Object value) {
        if (value == null) {
            if (!optional) {
                throw new IllegalStateException("Property " + nameOnModel + " requires a value.");
            }
            return null;
        }
        return encode(value);
    }

    /**
     * 저장된 wire 값으로부터 모델 값 준비.
     *
     * @param entity 복원 중인 엔티티 (nullable)
     * @param value wire 값 (nullable)
     * @return 모델 값 또는 {@link #SKIP}
     */
    public Object prepareToLoad(Model entity, Object value) {
        if (value == null) {
            return null;
        }
        return decode(value);
    }

    /**
     * 이 속성의 wire 필드를 출력.
     *
     * @param entity 저장 중인 엔티티
     * @param sink (wire 필드 이름, wire 값) 소비자
     */
    public void store(Model entity, BiConsumer<String, Object> sink) {
        sink.accept(nameOnEntity, prepareToStore(entity, read(entity)));
    }

    /**
     * 저장된 데이터에서 이 속성의 값을 복원.
     *
     * @param entity 복원 중인 엔티티
     * @param data wire 필드 이름 → wire 값
     */
    public void load(Model entity, Map<String, Object> data) {
        Object value = prepareToLoad(entity, data.get(nameOnEntity));
        if (value == SKIP || (value == null && repeated)) {
            return;
        }
        entity.data().put(nameOnEntity, value);
    }

    /**
     * 이 엔티티에서 인덱스하지 않을 wire 필드 이름.
     *
     * @param entity 엔티티
     * @return 인덱스 제외 필드 이름 목록
     */
    public List<String> unindexedNames(Model entity) {
        return isIndexedFor(entity) ? List.of() : List.of(nameOnEntity);
    }

    /**
     * 필터 피연산자를 저장 표현으로 변환.
     *
     * <p>repeated 속성이라도 피연산자는 단일 원소입니다.</p>
     *
     * @param value 피연산자 (nullable)
     * @return wire 값
     * @throws IllegalArgumentException 타입이 맞지 않거나 필수 속성을 null과 비교하는 경우
     */
    public Object toWireValue(Object value) {
        if (value == null) {
            if (!optional) {
                throw new IllegalArgumentException("Required properties cannot be compared against null.");
            }
            return null;
        }
        return encodeElement(validateElement(value));
    }

    protected final Object encode(Object value) {
        if (repeated && value instanceof List<?> values) {
            List<Object> encoded = new ArrayList<>(values.size());
            for (Object element : values) {
                encoded.add(encodeElement(element));
            }
            return encoded;
        }
        return encodeElement(value);
    }

    protected final Object decode(Object value) {
        if (repeated && value instanceof List<?> values) {
            List<Object> decoded = new ArrayList<>(values.size());
            for (Object element : values) {
                decoded.add(decodeElement(element));
            }
            return decoded;
        }
        return decodeElement(value);
    }

    private Object encodeElement(Object value) {
        Object current = value;
        for (ValueCodec codec : codecs) {
            if (current == null) {
                break;
            }
            current = codec.encode(current);
        }
        return current;
    }

    private Object decodeElement(Object value) {
        Object current = value;
        ListIterator<ValueCodec> it = codecs.listIterator(codecs.size());
        while (it.hasPrevious() && current != null) {
            current = it.previous().decode(current);
        }
        return current;
    }

    // ========== Entity access ==========

    /**
     * 엔티티에서 현재 값 조회.
     *
     * <p>값이 없으면 기본값을, repeated이면 새 빈 리스트(엔티티에 저장됨)를 반환합니다.</p>
     *
     * @param entity 엔티티
     * @return 현재 값 (nullable)
     */
    protected Object read(Model entity) {
        Map<String, Object> data = entity.data();
        if (data.containsKey(nameOnEntity)) {
            return data.get(nameOnEntity);
        }
        if (defaultValue != null) {
            if (repeated) {
                List<Object> copy = new ArrayList<>((List<?>) defaultValue);
                data.put(nameOnEntity, copy);
                return copy;
            }
            return defaultValue;
        }
        if (repeated) {
            List<Object> empty = new ArrayList<>();
            data.put(nameOnEntity, empty);
            return empty;
        }
        return null;
    }

    /**
     * 검증 후 엔티티에 값 할당.
     *
     * @param entity 엔티티
     * @param value 할당할 값
     */
    protected void write(Model entity, Object value) {
        entity.data().put(nameOnEntity, validate(value));
    }

    /**
     * 엔티티의 원시 데이터 맵 (wire 필드 이름 → 모델 값).
     *
     * @param entity 엔티티
     * @return 수정 가능한 데이터 맵
     */
    protected static Map<String, Object> rawData(Model entity) {
        return entity.data();
    }

    // ========== Filters & orders ==========

    public PropertyFilter eq(Object value) {
        return buildFilter(PropertyFilter.Operator.EQ, value);
    }

    public PropertyFilter lt(Object value) {
        return buildFilter(PropertyFilter.Operator.LT, value);
    }

    public PropertyFilter le(Object value) {
        return buildFilter(PropertyFilter.Operator.LE, value);
    }

    public PropertyFilter gt(Object value) {
        return buildFilter(PropertyFilter.Operator.GT, value);
    }

    public PropertyFilter ge(Object value) {
        return buildFilter(PropertyFilter.Operator.GE, value);
    }

    /**
     * null 비교 필터.
     *
     * @return {@code name = null} 필터
     * @throws IllegalArgumentException 필수 속성인 경우
     */
    public PropertyFilter isNull() {
        if (!optional) {
            throw new IllegalArgumentException("Required properties cannot be compared against null.");
        }
        return buildFilter(PropertyFilter.Operator.EQ, null);
    }

    protected final PropertyFilter buildFilter(PropertyFilter.Operator operator, Object value) {
        if (!indexed) {
            throw new IllegalArgumentException(nameOnModel + " is not indexed.");
        }
        return new PropertyFilter(nameOnEntity, operator, toWireValue(value));
    }

    public PropertyOrder asc() {
        return PropertyOrder.asc(nameOnEntity);
    }

    public PropertyOrder desc() {
        return PropertyOrder.desc(nameOnEntity);
    }

    // ========== Embedding ==========

    /**
     * 이름 앞에 접두사가 붙은 복사본 생성 (Embed 필드 뷰).
     *
     * @param entityPrefix wire 이름 접두사 (예: {@code "child."})
     * @param modelPrefix 모델 이름 접두사 (예: {@code "nested."})
     * @return 접두사가 붙은 복사본
     */
    public abstract Property<T> withPrefix(String entityPrefix, String modelPrefix);

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + nameOnModel + ")";
    }

    /**
     * 속성 빌더 기반 클래스.
     *
     * @param <P> 생성할 속성 타입
     * @param <B> 빌더 자신의 타입
     */
    public abstract static class Builder<P extends Property<?>, B extends Builder<P, B>> {

        protected final String name;
        protected String entityName;
        protected Object defaultValue;
        protected boolean indexed;
        protected IndexCondition indexedIf;
        protected boolean optional;
        protected boolean repeated;

        /**
         * @param name 모델 속성 이름
         * @throws IllegalArgumentException name이 비어있는 경우
         */
        protected Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name cannot be null or blank");
            }
            this.name = name;
        }

        /**
         * 엔티티(wire) 필드 이름 지정.
         */
        public B name(String entityName) {
            if (entityName == null || entityName.isBlank()) {
                throw new IllegalArgumentException("entityName cannot be null or blank");
            }
            this.entityName = entityName;
            return self();
        }

        public B defaultValue(Object defaultValue) {
            this.defaultValue = defaultValue;
            return self();
        }

        public B indexed() {
            return indexed(true);
        }

        public B indexed(boolean indexed) {
            this.indexed = indexed;
            return self();
        }

        public B indexedIf(IndexCondition condition) {
            this.indexedIf = condition;
            return self();
        }

        public B optional() {
            return optional(true);
        }

        public B optional(boolean optional) {
            this.optional = optional;
            return self();
        }

        public B repeated() {
            this.repeated = true;
            return self();
        }

        protected abstract B self();

        protected abstract P create();

        /**
         * 속성 생성.
         *
         * @return 속성
         * @throws IllegalArgumentException 옵션 조합이 잘못되었거나 기본값이 유효하지 않은 경우
         */
        public final P build() {
            P property = create();
            ((Property<?>) property).initialize(defaultValue);
            return property;
        }
    }
}
