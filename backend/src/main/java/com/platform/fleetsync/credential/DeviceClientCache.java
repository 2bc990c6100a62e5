package com.platform.fleetsync.credential;

import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.protocol.DeviceClient;
import com.platform.fleetsync.protocol.DeviceClientFactory;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.Generation;
import io.micrometer.core.instrument.Gauge;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Live device clients keyed by device address.
 * 
 * An entry is reused only while it matches the requested generation and
 * credential; otherwise it is replaced.
 */
@Slf4j
@Component
public class DeviceClientCache {
    
    private record Entry(DeviceClient client, Generation generation, DeviceCredential credential) {
        
        boolean matches(Generation requestedGeneration, DeviceCredential requestedCredential) {
            return generation == requestedGeneration && Objects.equals(credential, requestedCredential);
        }
    }
    
    private final Map<String, Entry> clients = new HashMap<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final DeviceClientFactory factory;
    private final MetricsRegistry metricsRegistry;
    
    public DeviceClientCache(DeviceClientFactory factory, MetricsRegistry metricsRegistry) {
        this.factory = factory;
        this.metricsRegistry = metricsRegistry;
        
        Gauge.builder("fleetsync.client.cache.size", this, DeviceClientCache::size)
            .description("Number of cached device clients")
            .register(metricsRegistry.getMeterRegistry());
    }
    
    public DeviceClient getOrCreate(String ip, Generation generation, DeviceCredential credential) {
        lock.readLock().lock();
        try {
            Entry entry = clients.get(ip);
            if (entry != null && entry.matches(generation, credential)) {
                return entry.client();
            }
        } finally {
            lock.readLock().unlock();
        }
        
        lock.writeLock().lock();
        try {
            Entry entry = clients.get(ip);
            if (entry != null && entry.matches(generation, credential)) {
                return entry.client();
            }
            DeviceClient client = factory.create(ip, generation, credential);
            clients.put(ip, new Entry(client, generation, credential));
            log.debug("Cached {} client for {} (authenticated: {})", generation, ip, credential != null);
            return client;
        } finally {
            lock.writeLock().unlock();
        }
    }
    
    public void invalidate(String ip, String reason) {
        if (ip == null) {
            return;
        }
        Entry removed;
        lock.writeLock().lock();
        try {
            removed = clients.remove(ip);
        } finally {
            lock.writeLock().unlock();
        }
        if (removed != null) {
            log.debug("Invalidated cached client for {} ({})", ip, reason);
            metricsRegistry.recordCacheInvalidation(reason);
        }
    }
    
    /**
     * Drop the cached client only while it still uses {@code credential}. A client
     * rebuilt meanwhile for another credential is kept.
     */
    public boolean invalidate(String ip, DeviceCredential credential, String reason) {
        if (ip == null) {
            return false;
        }
        lock.writeLock().lock();
        try {
            Entry entry = clients.get(ip);
            if (entry == null || !Objects.equals(entry.credential(), credential)) {
                return false;
            }
            clients.remove(ip);
        } finally {
            lock.writeLock().unlock();
        }
        log.debug("Invalidated cached client for {} ({})", ip, reason);
        metricsRegistry.recordCacheInvalidation(reason);
        return true;
    }
    
    public void clear() {
        int cleared;
        lock.writeLock().lock();
        try {
            cleared = clients.size();
            clients.clear();
        } finally {
            lock.writeLock().unlock();
        }
        log.info("Cleared {} cached device clients", cleared);
        metricsRegistry.recordCacheInvalidation("clear");
    }
    
    public boolean contains(String ip) {
        lock.readLock().lock();
        try {
            return clients.containsKey(ip);
        } finally {
            lock.readLock().unlock();
        }
    }
    
    public int size() {
        lock.readLock().lock();
        try {
            return clients.size();
        } finally {
            lock.readLock().unlock();
        }
    }
}
