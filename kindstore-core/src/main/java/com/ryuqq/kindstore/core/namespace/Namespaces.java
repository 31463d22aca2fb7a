package com.ryuqq.kindstore.core.namespace;

/**
 * 현재 스레드의 기본 namespace 관리.
 *
 * <p>namespace는 두 단계로 결정됩니다:</p>
 * <ul>
 *   <li>스레드 로컬 namespace ({@link #set(String)}로 지정한 경우)</li>
 *   <li>프로세스 전역 기본 namespace ({@link #setDefault(String)}, 기본값 빈 문자열)</li>
 * </ul>
 *
 * <p>namespace 없이 생성된 Key와 Query는 생성 시점의 {@link #current()} 값을 사용합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * try (Namespaces.Scope ignored = Namespaces.scoped("tenant-a")) {
 *     Key key = Key.of("Person", 1L);   // namespace = "tenant-a"
 * }
 * // 이전 namespace로 복원됨
 * </pre>
 *
 * @author Kindstore Team
 * @since 1.0.0
 */
public final class Namespaces {

    private static volatile String defaultNamespace = "";

    private static final ThreadLocal<String> CURRENT = new ThreadLocal<>();

    private Namespaces() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 전역 기본 namespace 설정.
     *
     * @param namespace 기본 namespace (null이면 빈 문자열)
     * @return 설정된 namespace
     */
    public static String setDefault(String namespace) {
        defaultNamespace = namespace == null ? "" : namespace;
        return defaultNamespace;
    }

    /**
     * 현재 스레드의 namespace 조회.
     *
     * @return 스레드 로컬 namespace, 없으면 전역 기본 namespace
     */
    public static String current() {
        String namespace = CURRENT.get();
        return namespace != null ? namespace : defaultNamespace;
    }

    /**
     * 스레드 로컬 namespace 설정.
     *
     * <p>null을 전달하면 스레드 로컬 값이 제거되어 전역 기본값을 사용합니다.</p>
     *
     * @param namespace 스레드 로컬 namespace
     */
    public static void set(String namespace) {
        if (namespace == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(namespace);
        }
    }

    /**
     * 스레드 로컬 namespace 제거.
     */
    public static void clear() {
        CURRENT.remove();
    }

    /**
     * 블록 범위 namespace 지정.
     *
     * <p>반환된 {@link Scope}를 닫으면 이전 스레드 로컬 namespace가 복원됩니다.
     * 이전 값이 없었다면 스레드 로컬 값이 제거됩니다.</p>
     *
     * @param namespace 블록 안에서 사용할 namespace
     * @return 복원용 Scope
     */
    public static Scope scoped(String namespace) {
        String previous = CURRENT.get();
        set(namespace);
        return () -> set(previous);
    }

    /**
     * {@link #scoped(String)}가 반환하는 복원 핸들.
     */
    @FunctionalInterface
    public interface Scope extends AutoCloseable {

        @Override
        void close();
    }
}
