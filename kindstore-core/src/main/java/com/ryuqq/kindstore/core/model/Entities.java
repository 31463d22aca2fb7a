package com.ryuqq.kindstore.core.model;

import com.ryuqq.kindstore.core.key.Key;
import com.ryuqq.kindstore.core.spi.Adapter;
import com.ryuqq.kindstore.core.spi.PutRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 엔티티 배치 연산 (get / put / delete).
 *
 * <p><strong>공통 규칙:</strong></p>
 * <ul>
 *   <li>배치의 모든 모델은 하나의 어댑터로 해석되어야 함 (모델 전용 어댑터 또는 전역 어댑터)</li>
 *   <li>서로 다른 어댑터가 섞이면 {@link IllegalStateException}</li>
 *   <li>hook이 예외를 던지면 어댑터 호출 없이 배치 전체가 중단됨</li>
 * </ul>
 *
 * <p><strong>실행 순서:</strong></p>
 * <ul>
 *   <li>get: Key 검증 → preGetHook → adapter.getMulti → 로드 → postGetHook</li>
 *   <li>put: prePutHook → adapter.putMulti → Key 할당 → postPutHook</li>
 *   <li>delete: Key 검증 → preDeleteHook → adapter.deleteMulti → postDeleteHook</li>
 * </ul>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Entities {

    private static final Logger log = LoggerFactory.getLogger(Entities.class);

    private Entities() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    // ========== Get ==========

    /**
     * 여러 엔티티 조회.
     *
     * @param keys 조회할 Key 목록 (모두 완전한 Key)
     * @return 입력 순서대로 정렬된 엔티티, 없는 엔티티는 null
     * @throws IllegalStateException partial Key, 알 수 없는 kind, 어댑터 혼용
     */
    public static List<Model> getMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (keys.isEmpty()) {
            return new ArrayList<>();
        }

        List<ModelSchema<?>> schemas = new ArrayList<>(keys.size());
        for (Key key : keys) {
            requireComplete(key, "get");
            schemas.add(ModelRegistry.lookup(key.getKind()));
        }
        Adapter adapter = resolveAdapter(schemas);

        for (int i = 0; i < keys.size(); i++) {
            schemas.get(i).runPreGetHook(keys.get(i));
        }

        log.debug("getMulti: {} key(s)", keys.size());
        List<Map<String, Object>> rows = adapter.getMulti(keys);

        List<Model> entities = new ArrayList<>(keys.size());
        for (int i = 0; i < keys.size(); i++) {
            Map<String, Object> row = rows.get(i);
            entities.add(row == null ? null : schemas.get(i).load(keys.get(i), row));
        }
        for (Model entity : entities) {
            if (entity != null) {
                entity.postGetHook();
            }
        }
        return entities;
    }

    /**
     * 단일 엔티티 조회.
     *
     * @param key 완전한 Key
     * @return 엔티티, 없으면 null
     */
    public static Model get(Key key) {
        return getMulti(Collections.singletonList(key)).get(0);
    }

    /**
     * 단일 엔티티를 타입으로 조회.
     *
     * @param key 완전한 Key
     * @param type 기대하는 모델 타입
     * @param <M> 모델 타입
     * @return 엔티티, 없으면 null
     * @throws ClassCastException 저장된 엔티티가 기대 타입이 아닌 경우
     */
    public static <M extends Model> M get(Key key, Class<M> type) {
        Model entity = get(key);
        return entity == null ? null : type.cast(entity);
    }

    /**
     * 스키마와 id로 단일 엔티티 조회.
     *
     * @param schema 모델 스키마
     * @param idOrName id 또는 name
     * @param <M> 모델 타입
     * @return 엔티티, 없으면 null
     */
    public static <M extends Model> M get(ModelSchema<M> schema, Object idOrName) {
        return schema.get(idOrName);
    }

    // ========== Put ==========

    /**
     * 여러 엔티티 저장.
     *
     * @param entities 저장할 엔티티 목록
     * @param <M> 모델 타입
     * @return 같은 엔티티 목록 (Key가 완성됨)
     * @throws IllegalStateException 필수 속성 누락 또는 어댑터 혼용
     */
    public static <M extends Model> List<M> putMulti(List<M> entities) {
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        if (entities.isEmpty()) {
            return entities;
        }

        List<ModelSchema<?>> schemas = new ArrayList<>(entities.size());
        for (M entity : entities) {
            if (entity == null) {
                throw new IllegalArgumentException("entities cannot contain null");
            }
            schemas.add(entity.schema());
        }
        Adapter adapter = resolveAdapter(schemas);

        for (M entity : entities) {
            entity.prePutHook();
        }

        List<PutRequest> requests = new ArrayList<>(entities.size());
        for (M entity : entities) {
            requests.add(new PutRequest(entity.getKey(), entity.unindexedProperties(), entity.toEntityData()));
        }

        log.debug("putMulti: {} entit{}", entities.size(), entities.size() == 1 ? "y" : "ies");
        List<Key> keys = adapter.putMulti(requests);

        for (int i = 0; i < entities.size(); i++) {
            entities.get(i).setKey(keys.get(i));
        }
        for (M entity : entities) {
            entity.postPutHook();
        }
        return entities;
    }

    /**
     * 단일 엔티티 저장.
     *
     * @param entity 저장할 엔티티
     * @param <M> 모델 타입
     * @return 같은 엔티티 (Key가 완성됨)
     */
    public static <M extends Model> M put(M entity) {
        return putMulti(Collections.singletonList(entity)).get(0);
    }

    // ========== Delete ==========

    /**
     * 여러 엔티티 삭제.
     *
     * @param keys 삭제할 Key 목록 (모두 완전한 Key)
     * @throws IllegalStateException partial Key, 알 수 없는 kind, 어댑터 혼용
     */
    public static void deleteMulti(List<Key> keys) {
        if (keys == null) {
            throw new IllegalArgumentException("keys cannot be null");
        }
        if (keys.isEmpty()) {
            return;
        }

        List<ModelSchema<?>> schemas = new ArrayList<>(keys.size());
        for (Key key : keys) {
            requireComplete(key, "delete");
            schemas.add(ModelRegistry.lookup(key.getKind()));
        }
        Adapter adapter = resolveAdapter(schemas);

        for (int i = 0; i < keys.size(); i++) {
            schemas.get(i).runPreDeleteHook(keys.get(i));
        }

        log.debug("deleteMulti: {} key(s)", keys.size());
        adapter.deleteMulti(keys);

        for (int i = 0; i < keys.size(); i++) {
            schemas.get(i).runPostDeleteHook(keys.get(i));
        }
    }

    /**
     * 단일 엔티티 삭제.
     *
     * @param key 완전한 Key
     */
    public static void delete(Key key) {
        deleteMulti(Collections.singletonList(key));
    }

    // ========== Internal ==========

    private static void requireComplete(Key key, String operation) {
        if (key == null) {
            throw new IllegalArgumentException("keys cannot contain null");
        }
        if (key.isPartial()) {
            throw new IllegalStateException("Cannot " + operation + " partial key " + key + ".");
        }
    }

    private static Adapter resolveAdapter(List<ModelSchema<?>> schemas) {
        Adapter adapter = null;
        for (ModelSchema<?> schema : schemas) {
            Adapter candidate = schema.resolveAdapter();
            if (adapter == null) {
                adapter = candidate;
            } else if (adapter != candidate) {
                throw new IllegalStateException("Batch operations must use a single adapter.");
            }
        }
        return adapter;
    }
}
