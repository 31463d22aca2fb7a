package com.ryuqq.kindstore.core.model;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.query.Query;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.Adapters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * 모델 클래스의 명시적 스키마.
 *
 * <p>모델 클래스마다 한 번, 정적 초기화 시점에 {@link Builder#register()}로 생성되어
 * {@link ModelRegistry}에 등록됩니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>modelName: 모델 이름 (기본값은 클래스 simple name)</li>
 *   <li>kind: 저장소 kind (다형성 자식은 루트의 kind를 공유)</li>
 *   <li>properties: 기반 스키마의 속성 + 자신의 속성 (같은 이름은 재정의)</li>
 *   <li>kindChain: 자신부터 조상까지의 모델 이름 (가장 구체적인 것이 먼저)</li>
 *   <li>adapter: 모델 전용 어댑터 (없으면 전역 어댑터)</li>
 *   <li>preGet / preDelete / postDelete hook (Key 단위)</li>
 * </ul>
 *
 * <p><strong>다형성:</strong> {@link Builder#polymorphic()}로 표시된 루트를 확장한 모든 스키마는
 * 자식으로 표시되며, 저장 시 {@link Model#KINDS_FIELD}에 kindChain이 기록됩니다.
 * 로드 시 이 필드의 첫 번째 모델 이름으로 구체 클래스를 선택합니다.</p>
 *
 * @param <M> 모델 타입
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class ModelSchema<M extends Model> {

    private static final Consumer<Key> NO_HOOK = key -> { };

    private final Class<M> modelClass;
    private final Supplier<? extends M> factory;
    private final String modelName;
    private final String kind;
    private final boolean root;
    private final boolean child;
    private final ModelSchema<?> base;
    private final List<String> kindChain;
    private final Map<String, Property<?>> properties;
    private final Map<String, Property<?>> propertiesByEntityName;
    private final Adapter adapter;
    private final Consumer<Key> preGetHook;
    private final Consumer<Key> preDeleteHook;
    private final Consumer<Key> postDeleteHook;

    private ModelSchema(Builder<M> builder) {
        this.modelClass = builder.modelClass;
        this.factory = builder.factory;
        this.modelName = builder.kind != null ? builder.kind : builder.modelClass.getSimpleName();
        this.base = builder.base;
        this.root = builder.polymorphic;
        this.child = base != null && base.isPolymorphic();
        this.kind = child ? base.kind() : modelName;

        List<String> chain = new ArrayList<>();
        chain.add(modelName);
        if (base != null) {
            chain.addAll(base.kindChain());
        }
        this.kindChain = Collections.unmodifiableList(chain);

        Map<String, Property<?>> merged = new LinkedHashMap<>();
        if (base != null) {
            for (Property<?> property : base.properties()) {
                merged.put(property.nameOnModel(), property);
            }
        }
        for (Property<?> property : builder.properties) {
            merged.put(property.nameOnModel(), property);
        }
        Map<String, Property<?>> byEntityName = new HashMap<>();
        for (Property<?> property : merged.values()) {
            Property<?> clash = byEntityName.put(property.nameOnEntity(), property);
            if (clash != null) {
                throw new IllegalArgumentException(
                    "Properties " + clash.nameOnModel() + " and " + property.nameOnModel()
                        + " of " + modelName + " share the entity field " + property.nameOnEntity() + ".");
            }
            if (Model.KINDS_FIELD.equals(property.nameOnEntity())) {
                throw new IllegalArgumentException(Model.KINDS_FIELD + " is a reserved field name.");
            }
        }
        this.properties = Collections.unmodifiableMap(merged);
        this.propertiesByEntityName = Collections.unmodifiableMap(byEntityName);

        this.adapter = builder.adapter != null ? builder.adapter : (base != null ? base.adapter : null);
        this.preGetHook = inherit(builder.preGetHook, base != null ? base.preGetHook : null);
        this.preDeleteHook = inherit(builder.preDeleteHook, base != null ? base.preDeleteHook : null);
        this.postDeleteHook = inherit(builder.postDeleteHook, base != null ? base.postDeleteHook : null);
    }

    private static Consumer<Key> inherit(Consumer<Key> own, Consumer<Key> inherited) {
        if (own != null) {
            return own;
        }
        return inherited != null ? inherited : NO_HOOK;
    }

    /**
     * 스키마 빌더 생성.
     *
     * @param modelClass 모델 클래스
     * @param factory 인스턴스 생성자 (보통 {@code Person::new})
     * @param <M> 모델 타입
     * @return 빌더
     */
    public static <M extends Model> Builder<M> builder(Class<M> modelClass, Supplier<? extends M> factory) {
        return new Builder<>(modelClass, factory);
    }

    // ========== Metadata ==========

    public Class<M> modelClass() {
        return modelClass;
    }

    public String modelName() {
        return modelName;
    }

    public String kind() {
        return kind;
    }

    public boolean isRoot() {
        return root;
    }

    public boolean isChild() {
        return child;
    }

    public boolean isPolymorphic() {
        return root || child;
    }

    public ModelSchema<?> base() {
        return base;
    }

    public List<String> kindChain() {
        return kindChain;
    }

    public Collection<Property<?>> properties() {
        return properties.values();
    }

    /**
     * @param nameOnModel 모델 속성 이름
     * @return 속성, 없으면 null
     */
    public Property<?> property(String nameOnModel) {
        return properties.get(nameOnModel);
    }

    /**
     * @param nameOnEntity wire 필드 이름
     * @return 속성, 없으면 null
     */
    public Property<?> propertyByEntityName(String nameOnEntity) {
        return propertiesByEntityName.get(nameOnEntity);
    }

    /**
     * 이 모델이 사용할 어댑터.
     *
     * @return 모델 전용 어댑터, 없으면 전역 어댑터
     * @throws IllegalStateException 어느 쪽도 설정되지 않은 경우
     */
    public Adapter resolveAdapter() {
        return adapter != null ? adapter : Adapters.get();
    }

    // ========== Instances ==========

    /**
     * 빈 인스턴스 생성.
     *
     * @return 새 인스턴스 (partial Key)
     */
    public M newInstance() {
        return modelClass.cast(factory.get());
    }

    /**
     * 이 모델 kind의 Key 생성.
     *
     * @param idOrName id 또는 name
     * @return Key (현재 namespace)
     */
    public Key key(Object idOrName) {
        return new Key(kind, idOrName, null, null);
    }

    /**
     * 저장된 데이터로 엔티티 복원.
     *
     * <p>다형성 데이터에 {@link Model#KINDS_FIELD}가 있으면 가장 구체적인 모델 클래스로 복원합니다.</p>
     *
     * @param key 엔티티 Key
     * @param data wire 필드 이름 → wire 값
     * @return 복원된 엔티티
     * @throws IllegalStateException 기록된 모델 이름이 등록되어 있지 않은 경우
     */
    public Model load(Key key, Map<String, Object> data) {
        ModelSchema<?> target = this;
        if (isPolymorphic() && data.get(Model.KINDS_FIELD) instanceof List<?> chain && !chain.isEmpty()) {
            target = ModelRegistry.lookup(String.valueOf(chain.get(0)));
        }

        Model instance = target.newInstance();
        instance.setKey(key);
        for (Property<?> property : target.properties()) {
            property.load(instance, data);
        }
        return instance;
    }

    // ========== Shortcuts ==========

    /**
     * id로 엔티티 조회.
     *
     * @param idOrName id 또는 name
     * @return 엔티티, 없으면 null
     */
    public M get(Object idOrName) {
        return get(idOrName, null, null);
    }

    /**
     * id, 부모, namespace로 엔티티 조회.
     *
     * @param idOrName id 또는 name
     * @param parent 부모 Key (nullable)
     * @param namespace namespace (nullable, 현재 namespace)
     * @return 엔티티, 없으면 null
     */
    public M get(Object idOrName, Key parent, String namespace) {
        String ns = namespace != null ? namespace : (parent != null ? parent.getNamespace() : null);
        Model entity = Entities.get(new Key(kind, idOrName, parent, ns));
        return entity == null ? null : modelClass.cast(entity);
    }

    /**
     * 이 모델에 대한 쿼리 생성.
     *
     * @return 현재 namespace의 쿼리
     */
    public Query query() {
        return Query.of(modelName);
    }

    void runPreGetHook(Key key) {
        preGetHook.accept(key);
    }

    void runPreDeleteHook(Key key) {
        preDeleteHook.accept(key);
    }

    void runPostDeleteHook(Key key) {
        postDeleteHook.accept(key);
    }

    @Override
    public String toString() {
        return "ModelSchema(" + modelName + ", kind=" + kind + ")";
    }

    /**
     * {@link ModelSchema} 빌더.
     *
     * @param <M> 모델 타입
     */
    public static final class Builder<M extends Model> {

        private final Class<M> modelClass;
        private final Supplier<? extends M> factory;
        private final List<Property<?>> properties = new ArrayList<>();
        private String kind;
        private boolean polymorphic;
        private ModelSchema<?> base;
        private Adapter adapter;
        private Consumer<Key> preGetHook;
        private Consumer<Key> preDeleteHook;
        private Consumer<Key> postDeleteHook;

        private Builder(Class<M> modelClass, Supplier<? extends M> factory) {
            if (modelClass == null) {
                throw new IllegalArgumentException("modelClass cannot be null");
            }
            if (factory == null) {
                throw new IllegalArgumentException("factory cannot be null");
            }
            this.modelClass = modelClass;
            this.factory = factory;
        }

        /**
         * 모델 이름(kind) 지정. 기본값은 클래스 simple name.
         */
        public Builder<M> kind(String kind) {
            if (kind == null || kind.isBlank()) {
                throw new IllegalArgumentException("kind cannot be null or blank");
            }
            this.kind = kind;
            return this;
        }

        /**
         * 다형성 계층의 루트로 표시.
         */
        public Builder<M> polymorphic() {
            this.polymorphic = true;
            return this;
        }

        /**
         * 기반 모델 스키마 지정.
         *
         * @param base 상위 모델 클래스의 스키마
         * @throws IllegalArgumentException 모델 클래스가 base 모델 클래스의 하위 클래스가 아닌 경우
         */
        public Builder<M> extending(ModelSchema<?> base) {
            if (base == null) {
                throw new IllegalArgumentException("base cannot be null");
            }
            if (!base.modelClass().isAssignableFrom(modelClass) || base.modelClass() == modelClass) {
                throw new IllegalArgumentException(
                    modelClass.getSimpleName() + " is not a subclass of " + base.modelClass().getSimpleName());
            }
            this.base = base;
            return this;
        }

        public Builder<M> property(Property<?> property) {
            if (property == null) {
                throw new IllegalArgumentException("property cannot be null");
            }
            properties.add(property);
            return this;
        }

        public Builder<M> properties(Property<?>... properties) {
            for (Property<?> property : properties) {
                property(property);
            }
            return this;
        }

        /**
         * 모델 전용 어댑터 지정. 지정하지 않으면 전역 어댑터를 사용합니다.
         */
        public Builder<M> adapter(Adapter adapter) {
            this.adapter = adapter;
            return this;
        }

        public Builder<M> preGetHook(Consumer<Key> hook) {
            this.preGetHook = hook;
            return this;
        }

        public Builder<M> preDeleteHook(Consumer<Key> hook) {
            this.preDeleteHook = hook;
            return this;
        }

        public Builder<M> postDeleteHook(Consumer<Key> hook) {
            this.postDeleteHook = hook;
            return this;
        }

        /**
         * 스키마 생성 및 등록.
         *
         * @return 등록된 스키마
         * @throws IllegalArgumentException 같은 모델 이름이나 클래스가 이미 등록된 경우 (다형성 자식 제외)
         */
        public ModelSchema<M> register() {
            ModelSchema<M> schema = new ModelSchema<>(this);
            ModelRegistry.register(schema);
            return schema;
        }
    }
}
