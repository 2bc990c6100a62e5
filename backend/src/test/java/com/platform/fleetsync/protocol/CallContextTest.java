package com.platform.fleetsync.protocol;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class CallContextTest {

    @Test
    void withTimeout_neverExtendsParentDeadline() {
        CallContext parent = CallContext.root().withTimeout(Duration.ofMillis(200));
        CallContext child = parent.withTimeout(Duration.ofMinutes(5));

        assertThat(child.getDeadline()).isEqualTo(parent.getDeadline());
        assertThat(child.remaining()).isLessThanOrEqualTo(Duration.ofMillis(200));
    }

    @Test
    void cancel_propagatesToChildren() {
        CallContext root = CallContext.root();
        CallContext child = root.withTimeout(Duration.ofSeconds(10));
        CallContext grandChild = child.withTimeout(Duration.ofSeconds(5));

        root.cancel();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandChild.isCancelled()).isTrue();
    }

    @Test
    void close_detachesChildFromParent() {
        CallContext root = CallContext.root();
        CallContext child = root.withTimeout(Duration.ofSeconds(10));
        child.close();

        root.cancel();

        assertThat(child.isCancelled()).isFalse();
    }

    @Test
    void onCancel_afterCancellation_runsImmediately() {
        CallContext ctx = CallContext.root();
        ctx.cancel();
        AtomicInteger calls = new AtomicInteger();

        ctx.onCancel(calls::incrementAndGet);

        assertThat(calls).hasValue(1);
    }

    @Test
    void onCancel_unregistered_isNotRun() {
        CallContext ctx = CallContext.root();
        AtomicInteger calls = new AtomicInteger();
        Runnable unregister = ctx.onCancel(calls::incrementAndGet);

        unregister.run();
        ctx.cancel();

        assertThat(calls).hasValue(0);
    }

    @Test
    void remaining_afterDeadline_isZero() throws InterruptedException {
        CallContext ctx = CallContext.root().withTimeout(Duration.ofMillis(5));
        Thread.sleep(20);

        assertThat(ctx.isExpired()).isTrue();
        assertThat(ctx.remaining()).isEqualTo(Duration.ZERO);
    }
}
