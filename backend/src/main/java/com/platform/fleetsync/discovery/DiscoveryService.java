package com.platform.fleetsync.discovery;

import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceService;
import com.platform.fleetsync.error.DeviceCommunicationException;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceClientFactory;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.RootCallContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scans an address range for devices and reconciles what it finds.
 * 
 * Hosts are identified on a bounded pool; reconciliation runs on the calling thread in
 * address order, so inventory writes from one scan never race each other.
 */
@Slf4j
@Service
public class DiscoveryService {
    
    private final DeviceClientFactory clientFactory;
    private final DiscoveryReconciler reconciler;
    private final DiscoveryProperties properties;
    private final RootCallContext rootContext;
    private final StructuredLogger structuredLogger;
    
    public DiscoveryService(
            DeviceClientFactory clientFactory,
            DiscoveryReconciler reconciler,
            DiscoveryProperties properties,
            RootCallContext rootContext,
            StructuredLogger structuredLogger) {
        this.clientFactory = clientFactory;
        this.reconciler = reconciler;
        this.properties = properties;
        this.rootContext = rootContext;
        this.structuredLogger = structuredLogger;
    }
    
    public DiscoveryResult discover(String rangeExpression) {
        NetworkRange range = NetworkRange.parse(rangeExpression, properties.getMaxHosts());
        List<String> addresses = range.addresses();
        Instant startedAt = Instant.now();
        log.info("Starting discovery over {} ({} hosts)", range, addresses.size());
        
        List<Optional<DeviceInfo>> answers = identifyAll(addresses);
        
        int found = 0;
        int created = 0;
        int updated = 0;
        int unchanged = 0;
        int skipped = 0;
        List<Device> devices = new ArrayList<>();
        Instant discoveredAt = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        
        for (int i = 0; i < addresses.size(); i++) {
            Optional<DeviceInfo> info = answers.get(i);
            if (info.isEmpty()) {
                continue;
            }
            found++;
            String ip = addresses.get(i);
            String mac = DeviceService.normalizeMac(info.get().getMac());
            DiscoveredDevice observed = DiscoveredDevice.from(info.get(), ip, Device.STATUS_ONLINE, discoveredAt);
            String initialName = mac.isEmpty() ? null : properties.initialName(info.get(), mac);
            
            DiscoveryReconciler.Result result = reconciler.reconcile(observed, initialName);
            switch (result.outcome()) {
                case CREATED -> created++;
                case UPDATED -> updated++;
                case UNCHANGED -> unchanged++;
                case SKIPPED -> skipped++;
            }
            if (result.device() != null) {
                devices.add(result.device());
            }
        }
        
        long durationMs = Duration.between(startedAt, Instant.now()).toMillis();
        structuredLogger.discovery().scanCompleted(range.toString(), addresses.size(), found, durationMs);
        log.info("Discovery over {} complete: {} found, {} created, {} updated, {} unchanged, {} skipped in {}ms",
            range, found, created, updated, unchanged, skipped, durationMs);
        return new DiscoveryResult(range.toString(), addresses.size(), found, created, updated, unchanged,
            skipped, durationMs, devices);
    }
    
    private List<Optional<DeviceInfo>> identifyAll(List<String> addresses) {
        int threads = Math.max(1, Math.min(properties.getConcurrency(), addresses.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, new ScanThreadFactory());
        try {
            List<Future<Optional<DeviceInfo>>> futures = new ArrayList<>(addresses.size());
            for (String ip : addresses) {
                futures.add(pool.submit(() -> identify(ip)));
            }
            
            List<Optional<DeviceInfo>> results = new ArrayList<>(addresses.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    log.warn("Identifying {} failed: {}", addresses.get(i), e.getCause().getMessage());
                    results.add(Optional.empty());
                }
            }
            return results;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw DeviceNetworkException.cancelled(null, 0, "discover");
        } finally {
            pool.shutdownNow();
        }
    }
    
    /**
     * Empty when nothing answers at the address or the answer is not a device.
     */
    Optional<DeviceInfo> identify(String ip) {
        try (CallContext ctx = rootContext.get().withTimeout(properties.getHostTimeout())) {
            return Optional.of(clientFactory.describe(ctx, ip));
        } catch (DeviceNetworkException e) {
            log.trace("No answer from {}: {}", ip, e.getMessage());
            return Optional.empty();
        } catch (DeviceCommunicationException e) {
            log.debug("{} is not a supported device: {}", ip, e.getMessage());
            return Optional.empty();
        }
    }
    
    private static class ScanThreadFactory implements ThreadFactory {
        
        private final AtomicInteger counter = new AtomicInteger();
        
        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "discovery-scan-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
