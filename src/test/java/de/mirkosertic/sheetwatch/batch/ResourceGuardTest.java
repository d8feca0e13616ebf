package de.mirkosertic.sheetwatch.batch;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResourceGuard Tests")
class ResourceGuardTest {

    @Test
    @DisplayName("Usage under the limit passes without pausing")
    void underLimit() {
        final ResourceGuard guard = new ResourceGuard(512, 60_000, () -> 100);

        assertThat(guard.overLimit()).isFalse();
        assertThat(guard.ensureCapacity()).isTrue();
    }

    @Test
    @DisplayName("Usage that drops after the pause lets work continue")
    void recoversAfterPause() {
        final AtomicInteger calls = new AtomicInteger();
        final ResourceGuard guard = new ResourceGuard(512, 10, () -> calls.getAndIncrement() < 2 ? 900 : 200);

        assertThat(guard.ensureCapacity()).isTrue();
    }

    @Test
    @DisplayName("Usage that stays over the limit halts work")
    void staysOverLimit() {
        final ResourceGuard guard = new ResourceGuard(512, 10, () -> 900);

        assertThat(guard.overLimit()).isTrue();
        assertThat(guard.ensureCapacity()).isFalse();
    }

    @Test
    @DisplayName("Non-positive limit disables the guard")
    void disabled() {
        final ResourceGuard guard = new ResourceGuard(0, 10, () -> Long.MAX_VALUE);

        assertThat(guard.overLimit()).isFalse();
        assertThat(guard.ensureCapacity()).isTrue();
    }

    @Test
    @DisplayName("Default guard measures the heap")
    void measuresHeap() {
        assertThat(new ResourceGuard(512, 10).currentUsageMB()).isPositive();
    }
}
