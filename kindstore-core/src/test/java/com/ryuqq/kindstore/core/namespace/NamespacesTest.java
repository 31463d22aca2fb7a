package com.ryuqq.kindstore.core.namespace;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class NamespacesTest {

    @AfterEach
    void tearDown() {
        Namespaces.clear();
        Namespaces.setDefault("");
    }

    @Test
    @DisplayName("스레드 로컬 값이 없으면 전역 기본값을 사용한다")
    void fallsBackToDefault() {
        Namespaces.setDefault("global");

        assertThat(Namespaces.current()).isEqualTo("global");
        Namespaces.set("local");
        assertThat(Namespaces.current()).isEqualTo("local");
        Namespaces.clear();
        assertThat(Namespaces.current()).isEqualTo("global");
    }

    @Test
    @DisplayName("scoped는 닫힐 때 이전 값을 복원한다")
    void scopedRestoresPrevious() {
        Namespaces.set("outer");

        try (Namespaces.Scope ignored = Namespaces.scoped("inner")) {
            assertThat(Namespaces.current()).isEqualTo("inner");
            try (Namespaces.Scope nested = Namespaces.scoped("innermost")) {
                assertThat(Namespaces.current()).isEqualTo("innermost");
            }
            assertThat(Namespaces.current()).isEqualTo("inner");
        }

        assertThat(Namespaces.current()).isEqualTo("outer");
    }

    @Test
    @DisplayName("스레드 로컬 namespace는 다른 스레드에 보이지 않는다")
    void threadLocalIsolation() {
        Namespaces.set("mine");

        String seenByOther = CompletableFuture.supplyAsync(Namespaces::current).join();

        assertThat(seenByOther).isEmpty();
        assertThat(Namespaces.current()).isEqualTo("mine");
    }
}
