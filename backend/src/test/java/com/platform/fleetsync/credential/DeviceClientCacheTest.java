package com.platform.fleetsync.credential;

import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.protocol.DeviceClient;
import com.platform.fleetsync.protocol.DeviceClientFactory;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.Generation;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeviceClientCacheTest {

    private static final String IP = "10.0.0.9";
    private static final DeviceCredential OLD = new DeviceCredential("admin", "old");
    private static final DeviceCredential NEW = new DeviceCredential("admin", "new");

    private DeviceClientFactory factory;
    private DeviceClientCache cache;

    @BeforeEach
    void setUp() {
        factory = mock(DeviceClientFactory.class);
        cache = new DeviceClientCache(factory, new MetricsRegistry(new SimpleMeterRegistry()));
    }

    @Test
    void getOrCreate_concurrentCallsForSameAddress_createOneClient() throws Exception {
        when(factory.create(IP, Generation.GEN2, OLD)).thenAnswer(invocation -> {
            Thread.sleep(20);
            return mock(DeviceClient.class);
        });
        int threads = 16;
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<DeviceClient>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return cache.getOrCreate(IP, Generation.GEN2, OLD);
                }));
            }
            start.countDown();

            DeviceClient first = futures.get(0).get(5, TimeUnit.SECONDS);
            for (Future<DeviceClient> future : futures) {
                assertThat(future.get(5, TimeUnit.SECONDS)).isSameAs(first);
            }
        } finally {
            pool.shutdownNow();
        }

        verify(factory, times(1)).create(any(), any(), any());
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void getOrCreate_credentialChanged_replacesClient() {
        DeviceClient oldClient = mock(DeviceClient.class);
        DeviceClient newClient = mock(DeviceClient.class);
        when(factory.create(IP, Generation.GEN2, OLD)).thenReturn(oldClient);
        when(factory.create(IP, Generation.GEN2, NEW)).thenReturn(newClient);

        assertThat(cache.getOrCreate(IP, Generation.GEN2, OLD)).isSameAs(oldClient);
        assertThat(cache.getOrCreate(IP, Generation.GEN2, NEW)).isSameAs(newClient);
        assertThat(cache.size()).isEqualTo(1);
    }

    @Test
    void invalidate_withOtherCredential_keepsNewerClient() {
        DeviceClient newClient = mock(DeviceClient.class);
        when(factory.create(IP, Generation.GEN2, NEW)).thenReturn(newClient);
        cache.getOrCreate(IP, Generation.GEN2, NEW);

        boolean removed = cache.invalidate(IP, OLD, "auth_failure");

        assertThat(removed).isFalse();
        assertThat(cache.getOrCreate(IP, Generation.GEN2, NEW)).isSameAs(newClient);
        verify(factory, times(1)).create(IP, Generation.GEN2, NEW);
    }

    @Test
    void invalidate_withMatchingCredential_removesClient() {
        when(factory.create(IP, Generation.GEN2, OLD)).thenReturn(mock(DeviceClient.class));
        cache.getOrCreate(IP, Generation.GEN2, OLD);

        assertThat(cache.invalidate(IP, OLD, "auth_failure")).isTrue();
        assertThat(cache.contains(IP)).isFalse();
    }

    @Test
    void invalidate_byAddress_removesRegardlessOfCredential() {
        when(factory.create(IP, Generation.GEN1, null)).thenReturn(mock(DeviceClient.class));
        cache.getOrCreate(IP, Generation.GEN1, null);

        cache.invalidate(IP, "address_changed");

        assertThat(cache.contains(IP)).isFalse();
    }
}
