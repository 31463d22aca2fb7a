package com.ryuqq.kindstore.core.key;

import com.ryuqq.kindstore.core.namespace.Namespaces;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Datastore 엔티티의 계층형 식별자.
 *
 * <p>Key는 kind, id(정수) 또는 name(문자열), 부모 Key, namespace로 구성됩니다.
 * id가 없는 Key는 <em>partial</em> Key이며 아직 저장되지 않은 엔티티를 나타냅니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>path = 부모 path + (kind[, id])</li>
 *   <li>path 길이가 홀수이면 partial</li>
 *   <li>부모 Key는 partial일 수 없음</li>
 *   <li>동등성: (path, namespace) 기준 구조적 비교</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가. id 할당은 {@link #withId(Object)}로 새 Key를 만듭니다.</p>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Key {

    private final String kind;
    private final Object idOrName;
    private final Key parent;
    private final String namespace;
    private final List<Object> path;

    /**
     * Key 생성.
     *
     * @param kind kind 이름
     * @param idOrName Long/Integer id, String name, 또는 null (partial)
     * @param parent 부모 Key (nullable, partial 불가)
     * @param namespace namespace (null이면 {@link Namespaces#current()})
     * @throws IllegalArgumentException kind가 비어있거나, id 타입이 잘못되었거나, 부모가 partial인 경우
     */
    public Key(String kind, Object idOrName, Key parent, String namespace) {
        if (kind == null || kind.isBlank()) {
            throw new IllegalArgumentException("kind cannot be null or blank");
        }
        if (parent != null && parent.isPartial()) {
            throw new IllegalArgumentException("Cannot use partial Keys as parents.");
        }
        this.kind = kind;
        this.idOrName = normalizeId(idOrName);
        this.parent = parent;
        this.namespace = namespace != null ? namespace : Namespaces.current();

        List<Object> segments = new ArrayList<>();
        if (parent != null) {
            segments.addAll(parent.path);
        }
        segments.add(kind);
        if (this.idOrName != null) {
            segments.add(this.idOrName);
        }
        this.path = Collections.unmodifiableList(segments);
    }

    /**
     * partial Key 생성.
     *
     * @param kind kind 이름
     * @return partial Key
     */
    public static Key of(String kind) {
        return new Key(kind, null, null, null);
    }

    /**
     * 정수 id Key 생성.
     *
     * @param kind kind 이름
     * @param id 정수 id
     * @return Key
     */
    public static Key of(String kind, long id) {
        return new Key(kind, id, null, null);
    }

    /**
     * 문자열 name Key 생성.
     *
     * @param kind kind 이름
     * @param name 문자열 name
     * @return Key
     */
    public static Key of(String kind, String name) {
        return new Key(kind, name, null, null);
    }

    /**
     * 부모를 가진 Key 생성.
     *
     * @param kind kind 이름
     * @param idOrName id 또는 name (nullable)
     * @param parent 부모 Key
     * @return Key
     */
    public static Key of(String kind, Object idOrName, Key parent) {
        return new Key(kind, idOrName, parent, parent != null ? parent.namespace : null);
    }

    /**
     * 평탄화된 path 토큰(kind, id, kind, id, ...)으로 Key 체인 재구성.
     *
     * <p>namespace는 체인의 모든 Key에 적용됩니다. 마지막 kind 뒤에 id가 없으면
     * partial Key가 반환됩니다.</p>
     *
     * @param namespace 모든 Key에 적용할 namespace (null이면 현재 namespace)
     * @param segments kind/id 교대 토큰
     * @return 마지막 Key
     * @throws IllegalArgumentException segments가 비었거나 kind 토큰이 문자열이 아닌 경우
     */
    public static Key fromPath(String namespace, Object... segments) {
        if (segments == null || segments.length == 0) {
            throw new IllegalArgumentException("path cannot be empty");
        }
        Key current = null;
        for (int i = 0; i < segments.length; i += 2) {
            if (!(segments[i] instanceof String segmentKind)) {
                throw new IllegalArgumentException("Path segment " + i + " must be a kind name: " + segments[i]);
            }
            Object id = i + 1 < segments.length ? segments[i + 1] : null;
            current = new Key(segmentKind, id, current, namespace);
        }
        return current;
    }

    /**
     * {@link #fromPath(String, Object...)}와 같지만 List 형태의 path를 받음.
     *
     * @param namespace namespace
     * @param segments path 토큰
     * @return 마지막 Key
     */
    public static Key fromPath(String namespace, List<?> segments) {
        return fromPath(namespace, segments.toArray());
    }

    private static Object normalizeId(Object idOrName) {
        if (idOrName == null || idOrName instanceof Long || idOrName instanceof String) {
            return idOrName;
        }
        if (idOrName instanceof Integer || idOrName instanceof Short || idOrName instanceof Byte) {
            return ((Number) idOrName).longValue();
        }
        throw new IllegalArgumentException(
            "Key ids must be integers or strings, got " + idOrName.getClass().getSimpleName()
        );
    }

    /**
     * id가 할당된 새 Key 생성.
     *
     * @param id 할당할 id 또는 name
     * @return 같은 kind/parent/namespace를 가진 완성된 Key
     */
    public Key withId(Object id) {
        return new Key(kind, id, parent, namespace);
    }

    public String getKind() {
        return kind;
    }

    public Object getIdOrName() {
        return idOrName;
    }

    public Key getParent() {
        return parent;
    }

    public String getNamespace() {
        return namespace;
    }

    /**
     * 전체 path 조회.
     *
     * @return 조상부터 자신까지의 (kind, id) 토큰 목록 (수정 불가)
     */
    public List<Object> path() {
        return path;
    }

    /**
     * partial 여부.
     *
     * @return id가 없으면 true
     */
    public boolean isPartial() {
        return path.size() % 2 != 0;
    }

    /**
     * 정수 id 조회.
     *
     * @return 정수 id, 문자열 name이거나 partial이면 null
     */
    public Long intId() {
        return idOrName instanceof Long id ? id : null;
    }

    /**
     * 문자열 name 조회.
     *
     * @return 문자열 name, 정수 id이거나 partial이면 null
     */
    public String strId() {
        return idOrName instanceof String name ? name : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Key other = (Key) o;
        return namespace.equals(other.namespace) && path.equals(other.path);
    }

    @Override
    public int hashCode() {
        return Objects.hash(path, namespace);
    }

    @Override
    public String toString() {
        String id = idOrName instanceof String name ? "'" + name + "'" : String.valueOf(idOrName);
        return "Key('" + kind + "', " + id + ", parent=" + parent + ", namespace='" + namespace + "')";
    }
}
