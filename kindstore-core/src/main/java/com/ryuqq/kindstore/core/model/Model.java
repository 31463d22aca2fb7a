package com.ryuqq.kindstore.core.model;

import com.ryuqq.kindstore.core.key.Key;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 모든 모델 엔티티의 기반 클래스.
 *
 * <p>엔티티 값은 wire 필드 이름을 키로 하는 명시적 맵에 보관되며, 속성 디스크립터를 통해
 * 접근합니다. 각 모델 클래스는 {@link ModelSchema}를 정적 필드로 한 번 등록해야 합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>{@code
 * public class Person extends Model {
 *     public static final StringProperty EMAIL = StringProperty.builder("email").indexed().build();
 *     public static final StringProperty FIRST_NAME = StringProperty.builder("first_name").build();
 *
 *     public static final ModelSchema<Person> SCHEMA = ModelSchema.builder(Person.class, Person::new)
 *         .property(EMAIL)
 *         .property(FIRST_NAME)
 *         .register();
 * }
 *
 * Person person = new Person();
 * person.set(Person.EMAIL, "john@example.com");
 * person.put();
 * }</pre>
 *
 * <p><strong>Hook:</strong> {@link #prePutHook()}, {@link #postPutHook()}, {@link #postGetHook()}는
 * Key 기반 get/put에서만 실행되며 쿼리 결과에는 실행되지 않습니다.</p>
 *
 * <p>엔티티 인스턴스는 스레드 안전하지 않습니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public abstract class Model {

    /**
     * 다형성 엔티티의 클래스 계층(가장 구체적인 모델 이름부터)을 저장하는 예약 필드.
     */
    public static final String KINDS_FIELD = "^k";

    private final ModelSchema<?> schema;
    private final Map<String, Object> data = new LinkedHashMap<>();
    private Key key;

    protected Model() {
        this.schema = ModelRegistry.schemaOf(getClass());
        this.key = Key.of(schema.kind());
    }

    public ModelSchema<?> schema() {
        return schema;
    }

    public Key getKey() {
        return key;
    }

    /**
     * Key 교체.
     *
     * @param key 새 Key
     * @throws IllegalArgumentException key가 null인 경우
     */
    public void setKey(Key key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        this.key = key;
    }

    Map<String, Object> data() {
        return data;
    }

    // ========== Typed accessors ==========

    /**
     * 단일 값 속성 조회.
     *
     * @param property 속성
     * @param <T> 값 타입
     * @return 현재 값, 기본값 또는 null
     * @throws IllegalArgumentException 이 모델의 속성이 아니거나 repeated 속성인 경우
     */
    public <T> T get(Property<T> property) {
        checkOwned(property);
        if (property.isRepeated()) {
            throw new IllegalArgumentException(
                "Property " + property.nameOnModel() + " is repeated; use getAll().");
        }
        return property.valueType().cast(property.read(this));
    }

    /**
     * repeated 속성 조회.
     *
     * @param property repeated 속성
     * @param <T> 원소 타입
     * @return 엔티티 값에 바로 반영되는 수정 가능한 리스트 (추가되는 원소는 검증됨)
     * @throws IllegalArgumentException 이 모델의 속성이 아니거나 repeated 속성이 아닌 경우
     */
    public <T> List<T> getAll(Property<T> property) {
        checkOwned(property);
        if (!property.isRepeated()) {
            throw new IllegalArgumentException(
                "Property " + property.nameOnModel() + " is not repeated; use get().");
        }
        return new RepeatedValues<>(property, this);
    }

    /**
     * 단일 값 속성 할당.
     *
     * @param property 속성
     * @param value 값 (optional이면 null 허용)
     * @param <T> 값 타입
     * @return this
     * @throws IllegalArgumentException 값 검증에 실패한 경우
     * @throws UnsupportedOperationException 할당할 수 없는 속성(computed)인 경우
     */
    public <T> Model set(Property<T> property, T value) {
        checkOwned(property);
        property.write(this, value);
        return this;
    }

    /**
     * repeated 속성 할당.
     *
     * @param property repeated 속성
     * @param values 값 목록
     * @param <T> 원소 타입
     * @return this
     */
    public <T> Model setAll(Property<T> property, Collection<? extends T> values) {
        checkOwned(property);
        property.write(this, values);
        return this;
    }

    /**
     * 모델 속성 이름으로 값 조회.
     *
     * @param nameOnModel 모델 속성 이름
     * @return 현재 값
     * @throws IllegalArgumentException 알 수 없는 속성 이름인 경우
     */
    public Object get(String nameOnModel) {
        return propertyNamed(nameOnModel).read(this);
    }

    /**
     * 모델 속성 이름으로 값 할당.
     *
     * @param nameOnModel 모델 속성 이름
     * @param value 값
     * @return this
     * @throws IllegalArgumentException 알 수 없는 속성 이름이거나 값 검증에 실패한 경우
     */
    public Model set(String nameOnModel, Object value) {
        propertyNamed(nameOnModel).write(this, value);
        return this;
    }

    /**
     * 값 제거. 이후 조회 시 기본값 또는 재계산된 값이 반환됩니다.
     *
     * @param property 속성
     * @return this
     */
    public Model unset(Property<?> property) {
        checkOwned(property);
        data.remove(property.nameOnEntity());
        return this;
    }

    /**
     * 값이 명시적으로 설정되어 있는지 확인.
     *
     * @param property 속성
     * @return 데이터 맵에 값이 있으면 true (null 포함)
     */
    public boolean has(Property<?> property) {
        return data.containsKey(property.nameOnEntity());
    }

    /**
     * 현재 값 조회 (타입 없는 버전, 조건 평가용).
     *
     * @param property 속성
     * @return 현재 값
     */
    public Object valueOf(Property<?> property) {
        checkOwned(property);
        return property.read(this);
    }

    private Property<?> propertyNamed(String nameOnModel) {
        Property<?> property = schema.property(nameOnModel);
        if (property == null) {
            throw new IllegalArgumentException(
                getClass().getSimpleName() + " does not take a '" + nameOnModel + "' parameter.");
        }
        return property;
    }

    private void checkOwned(Property<?> property) {
        if (property == null) {
            throw new IllegalArgumentException("property cannot be null");
        }
        if (schema.property(property.nameOnModel()) != property) {
            throw new IllegalArgumentException(
                "Property " + property.nameOnModel() + " does not belong to " + schema.modelName() + ".");
        }
    }

    // ========== Persistence views ==========

    /**
     * 이 엔티티에서 인덱스하지 않을 wire 필드 이름.
     *
     * <p>인덱스 여부가 엔티티 값에 대한 조건으로 결정될 수 있으므로 엔티티마다 계산합니다.</p>
     *
     * @return 인덱스 제외 필드 이름 (선언 순서)
     */
    public List<String> unindexedProperties() {
        Set<String> names = new LinkedHashSet<>();
        for (Property<?> property : schema.properties()) {
            names.addAll(property.unindexedNames(this));
        }
        return new ArrayList<>(names);
    }

    /**
     * 저장할 wire 데이터 생성.
     *
     * <p>각 속성의 store를 선언 순서대로 실행하며, 다형성 모델은 {@link #KINDS_FIELD}를 추가합니다.</p>
     *
     * @return wire 필드 이름 → wire 값 (선언 순서)
     * @throws IllegalStateException 필수 속성에 값이 없는 경우
     */
    public Map<String, Object> toEntityData() {
        Map<String, Object> entityData = new LinkedHashMap<>();
        for (Property<?> property : schema.properties()) {
            property.store(this, entityData::put);
        }
        if (schema.isPolymorphic()) {
            entityData.put(KINDS_FIELD, new ArrayList<>(schema.kindChain()));
        }
        return entityData;
    }

    // ========== Hooks ==========

    /**
     * 저장 직전 실행. 예외를 던지면 배치 전체가 저장되지 않습니다.
     */
    protected void prePutHook() {
    }

    /**
     * 저장 직후 실행.
     */
    protected void postPutHook() {
    }

    /**
     * Key로 로드된 직후 실행.
     */
    protected void postGetHook() {
    }

    // ========== Persistence shortcuts ==========

    /**
     * 이 엔티티 저장.
     *
     * <p>구체 타입이 필요하면 {@link Entities#put(Model)}을 사용합니다.</p>
     *
     * @return this (Key가 완성됨)
     */
    public Model put() {
        return Entities.put(this);
    }

    /**
     * 이 엔티티 삭제.
     *
     * @throws IllegalStateException 저장된 적 없는(Key가 partial인) 경우
     */
    public void delete() {
        Entities.delete(key);
    }

    // ========== Object ==========

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Model other = (Model) o;
        if (!key.equals(other.key)) {
            return false;
        }
        for (Property<?> property : schema.properties()) {
            if (!valuesEqual(property.read(this), property.read(other))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public int hashCode() {
        return Objects.hash(getClass(), key);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(getClass().getSimpleName()).append("(key=").append(key);
        for (Property<?> property : schema.properties()) {
            sb.append(", ").append(property.nameOnModel()).append('=').append(repr(property.read(this)));
        }
        return sb.append(')').toString();
    }

    public static boolean valuesEqual(Object a, Object b) {
        if (a instanceof List<?> left && b instanceof List<?> right) {
            if (left.size() != right.size()) {
                return false;
            }
            for (int i = 0; i < left.size(); i++) {
                if (!valuesEqual(left.get(i), right.get(i))) {
                    return false;
                }
            }
            return true;
        }
        return Objects.deepEquals(a, b);
    }

    private static String repr(Object value) {
        if (value instanceof String s) {
            return "'" + s + "'";
        }
        if (value instanceof byte[] bytes) {
            return Arrays.toString(bytes);
        }
        return String.valueOf(value);
    }
}
