package com.adharvest.listings.engine;

import com.adharvest.listings.error.RunAbortedException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RunContextTest {

    @Test
    void shouldKeepFirstCancelReason() {
        RunContext context = RunContext.create();

        assertThat(context.cancel("first")).isTrue();
        assertThat(context.cancel("second")).isFalse();
        assertThat(context.abortReason()).isEqualTo("first");
        assertThatThrownBy(context::checkNotCancelled)
                .isInstanceOf(RunAbortedException.class)
                .hasMessageContaining("first");
    }

    @Test
    void shouldRunHookRegisteredAfterCancel() {
        RunContext context = RunContext.create();
        AtomicInteger hooks = new AtomicInteger();
        context.onCancel(hooks::incrementAndGet);
        context.cancel("stop");
        context.onCancel(hooks::incrementAndGet);

        assertThat(hooks).hasValue(2);
    }

    @Test
    void shouldCancelWhenErrorThresholdReached() {
        RunContext context = RunContext.create();

        context.recordError(2);
        assertThat(context.isCancelled()).isFalse();
        context.recordError(2);
        assertThat(context.isCancelled()).isTrue();
        assertThat(context.stats().getErrors()).isEqualTo(2);
    }

    @Test
    void shouldNeverCancelWithThresholdDisabled() {
        RunContext context = RunContext.create();
        IntStream.range(0, 50).forEach(i -> context.recordError(0));

        assertThat(context.isCancelled()).isFalse();
    }

    @Test
    void shouldRecordEachFingerprintOnceUnderContention() throws InterruptedException {
        FingerprintStore store = RunContext.create().fingerprints();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger accepted = new AtomicInteger();

        for (int t = 0; t < 8; t++) {
            pool.submit(() -> {
                start.await();
                for (String id : List.of("a", "b", "c", "d")) {
                    if (store.recordIfAbsent(id)) {
                        accepted.incrementAndGet();
                    }
                }
                return null;
            });
        }
        start.countDown();
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        assertThat(accepted).hasValue(4);
        assertThat(store.size()).isEqualTo(4);
        assertThat(store.seen("a")).isTrue();
        assertThat(store.seen("z")).isFalse();
    }
}
