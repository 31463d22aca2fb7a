package com.ryuqq.kindstore.core.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 프로세스 전역 모델 레지스트리.
 *
 * <p>모델 이름 → 스키마, 모델 클래스 → 스키마 매핑을 보관합니다.</p>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>등록: 클래스 초기화 시점에 여러 스레드에서 동시에 일어날 수 있으므로 락으로 직렬화</li>
 *   <li>조회: 락 없이 ConcurrentHashMap에서 읽음 (등록 후에는 추가만 발생)</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class ModelRegistry {

    private static final Logger log = LoggerFactory.getLogger(ModelRegistry.class);

    private static final ReentrantLock LOCK = new ReentrantLock();
    private static final Map<String, ModelSchema<?>> BY_NAME = new ConcurrentHashMap<>();
    private static final Map<Class<?>, ModelSchema<?>> BY_CLASS = new ConcurrentHashMap<>();

    private ModelRegistry() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void register(ModelSchema<?> schema) {
        LOCK.lock();
        try {
            if (BY_NAME.containsKey(schema.modelName()) && !schema.isChild()) {
                throw new IllegalArgumentException("Multiple models for kind '" + schema.modelName() + "'.");
            }
            if (BY_CLASS.containsKey(schema.modelClass())) {
                throw new IllegalArgumentException(
                    "Model class " + schema.modelClass().getName() + " is already registered.");
            }
            BY_NAME.put(schema.modelName(), schema);
            BY_CLASS.put(schema.modelClass(), schema);
        } finally {
            LOCK.unlock();
        }
        log.debug("Registered model {} (kind={}, polymorphic={})",
            schema.modelName(), schema.kind(), schema.isPolymorphic());
    }

    /**
     * 모델 이름으로 스키마 조회.
     *
     * @param modelName 모델 이름 (다형성 루트와 일반 모델은 kind와 같음)
     * @return 스키마
     * @throws IllegalStateException 등록되지 않은 경우
     */
    public static ModelSchema<?> lookup(String modelName) {
        ModelSchema<?> schema = BY_NAME.get(modelName);
        if (schema == null) {
            throw new IllegalStateException("Model for kind '" + modelName + "' not found.");
        }
        return schema;
    }

    /**
     * 모델 이름 등록 여부.
     *
     * @param modelName 모델 이름
     * @return 등록되어 있으면 true
     */
    public static boolean isRegistered(String modelName) {
        return BY_NAME.containsKey(modelName);
    }

    /**
     * 모델 클래스로 스키마 조회.
     *
     * <p>클래스가 아직 초기화되지 않았다면 초기화하여 정적 스키마 등록을 실행합니다.</p>
     *
     * @param modelClass 모델 클래스
     * @return 스키마
     * @throws IllegalStateException 클래스가 스키마를 등록하지 않은 경우
     */
    public static ModelSchema<?> schemaOf(Class<? extends Model> modelClass) {
        ModelSchema<?> schema = BY_CLASS.get(modelClass);
        if (schema == null) {
            initialize(modelClass);
            schema = BY_CLASS.get(modelClass);
        }
        if (schema == null) {
            throw new IllegalStateException(
                "Model class " + modelClass.getName() + " has no registered ModelSchema.");
        }
        return schema;
    }

    private static void initialize(Class<?> modelClass) {
        try {
            Class.forName(modelClass.getName(), true, modelClass.getClassLoader());
        } catch (ClassNotFoundException e) {
            throw new IllegalStateException("Cannot initialize model class " + modelClass.getName(), e);
        }
    }
}
