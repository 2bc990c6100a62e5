package com.platform.fleetsync.credential;

import com.platform.fleetsync.device.Device;
import com.platform.fleetsync.device.DeviceRepository;
import com.platform.fleetsync.error.CredentialRecoveryException;
import com.platform.fleetsync.error.DeviceAuthException;
import com.platform.fleetsync.error.DeviceCommunicationException;
import com.platform.fleetsync.error.ResourceNotFoundException;
import com.platform.fleetsync.observability.LoggingConfig;
import com.platform.fleetsync.observability.MetricsRegistry;
import com.platform.fleetsync.observability.StructuredLogger;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceClient;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.RootCallContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;

/**
 * Runs device operations through the client cache and credential recovery.
 * 
 * The only writer of a device's credential fields besides explicit credential
 * updates. A fallback credential is persisted only after a call using it has
 * succeeded.
 */
@Slf4j
@Service
public class DeviceConnectionService {
    
    private final DeviceRepository deviceRepository;
    private final DeviceClientCache clientCache;
    private final FallbackCredentialProperties fallbackProperties;
    private final RootCallContext rootContext;
    private final MetricsRegistry metricsRegistry;
    private final StructuredLogger structuredLogger;
    
    public DeviceConnectionService(
            DeviceRepository deviceRepository,
            DeviceClientCache clientCache,
            FallbackCredentialProperties fallbackProperties,
            RootCallContext rootContext,
            MetricsRegistry metricsRegistry,
            StructuredLogger structuredLogger) {
        this.deviceRepository = deviceRepository;
        this.clientCache = clientCache;
        this.fallbackProperties = fallbackProperties;
        this.rootContext = rootContext;
        this.metricsRegistry = metricsRegistry;
        this.structuredLogger = structuredLogger;
    }
    
    public <T> T execute(Long deviceId, String operation, Duration timeout, DeviceOperation<T> work) {
        Device device = deviceRepository.findById(deviceId)
            .orElseThrow(() -> ResourceNotFoundException.device(deviceId));
        return execute(device, operation, timeout, work);
    }
    
    /**
     * Run {@code work} against the device, recovering from a rejected credential
     * at most once. The passed device is refreshed in place when its credential
     * fields are rewritten.
     * 
     * @throws CredentialRecoveryException when no credential is accepted
     * @throws DeviceCommunicationException for network and protocol failures
     */
    public <T> T execute(Device device, String operation, Duration timeout, DeviceOperation<T> work) {
        return execute(device, operation, timeout, null, work);
    }
    
    /**
     * As {@link #execute(Device, String, Duration, DeviceOperation)}, with each call derived
     * from {@code parent} so cancelling it stops the operation. A null parent means the
     * application root context.
     */
    public <T> T execute(Device device, String operation, Duration timeout, CallContext parent,
                         DeviceOperation<T> work) {
        CallContext base = parent != null ? parent : rootContext.get();
        LoggingConfig.setDeviceContext(device.getId(), device.getIp());
        CredentialRecovery recovery = CredentialRecovery.start(
            device.getSettings().savedCredential(),
            device.isAuthEnabled(),
            fallbackProperties.credential());
        int reported = reportTransitions(device, recovery, 0);
        
        try {
            while (true) {
                DeviceCredential credential = recovery.nextAttempt();
                DeviceClient client = clientCache.getOrCreate(device.getIp(), device.getGeneration(), credential);
                long start = System.currentTimeMillis();
                try (CallContext ctx = base.withTimeout(timeout)) {
                    T result = work.apply(client, ctx);
                    metricsRegistry.recordDeviceCall(device.getGeneration().number(), operation, "success",
                        System.currentTimeMillis() - start);
                    
                    DeviceCredential verified = recovery.onSuccess();
                    reported = reportTransitions(device, recovery, reported);
                    if (verified != null) {
                        persistCredential(device, verified);
                    }
                    return result;
                } catch (DeviceAuthException e) {
                    metricsRegistry.recordDeviceCall(device.getGeneration().number(), operation, "auth_error",
                        System.currentTimeMillis() - start);
                    clientCache.invalidate(device.getIp(), credential, "auth_failure");
                    
                    boolean savedAttempt = recovery.getState() == CredentialState.USING_SAVED;
                    boolean retry = recovery.onAuthFailure();
                    reported = reportTransitions(device, recovery, reported);
                    if (savedAttempt && recovery.isClearSavedRequired()) {
                        clearSavedCredential(device, credential);
                    }
                    if (!retry) {
                        structuredLogger.credential().recoveryFailed(device.getId(), device.getIp(),
                            recovery.getAttempts(), e.getMessage());
                        throw new CredentialRecoveryException(device.getId(), recovery.getAttempts(),
                            "No credential accepted by device at " + device.getIp(), e);
                    }
                    log.info("Retrying {} on device {} with fallback credential", operation, device.getId());
                } catch (DeviceCommunicationException e) {
                    long elapsed = System.currentTimeMillis() - start;
                    metricsRegistry.recordDeviceCall(device.getGeneration().number(), operation, "error", elapsed);
                    structuredLogger.device().callFailed(device.getId(), device.getIp(),
                        device.getGeneration().number(), operation, e.getErrorCode().getCode(), e.getMessage(), elapsed);
                    throw e;
                }
            }
        } finally {
            LoggingConfig.clearDeviceContext();
        }
    }
    
    /**
     * Authenticated round trip. A failed test drops the cached client.
     */
    public void testConnection(Device device, Duration timeout) {
        try {
            execute(device, "test_connection", timeout, (client, ctx) -> {
                client.testConnection(ctx);
                return null;
            });
        } catch (RuntimeException e) {
            clientCache.invalidate(device.getIp(), "test_failed");
            throw e;
        }
    }
    
    private int reportTransitions(Device device, CredentialRecovery recovery, int alreadyReported) {
        List<CredentialRecovery.Transition> transitions = recovery.getTransitions();
        for (int i = alreadyReported; i < transitions.size(); i++) {
            CredentialRecovery.Transition t = transitions.get(i);
            log.debug("Credential state {} -> {} for device {} ({})", t.from(), t.to(), device.getId(), t.reason());
            metricsRegistry.recordCredentialTransition(t.from(), t.to());
            if (t.to() != CredentialState.VERIFIED && t.to() != CredentialState.USING_SAVED) {
                structuredLogger.credential().transition(device.getId(), device.getIp(),
                    t.from().name(), t.to().name());
            }
        }
        return transitions.size();
    }
    
    /**
     * Remove the saved credential only if it is still the one that was rejected.
     * Another operation may have verified and stored a newer one in the meantime.
     */
    private void clearSavedCredential(Device device, DeviceCredential rejected) {
        Device stored = deviceRepository.findById(device.getId()).orElse(device);
        if (rejected == null || !rejected.equals(stored.getSettings().savedCredential())) {
            refresh(device, stored);
            log.info("Saved credential on device {} changed since it was rejected, keeping it", device.getId());
            return;
        }
        stored.setSettings(stored.getSettings().withoutCredential());
        Device saved = deviceRepository.save(stored);
        refresh(device, saved);
        log.warn("[AUDIT] Cleared rejected saved credential on device {} ({})", device.getId(), device.getIp());
    }
    
    private void persistCredential(Device device, DeviceCredential credential) {
        Device stored = deviceRepository.findById(device.getId()).orElse(device);
        stored.setSettings(stored.getSettings().withCredential(credential));
        Device saved = deviceRepository.save(stored);
        refresh(device, saved);
        structuredLogger.credential().fallbackPersisted(device.getId(), device.getIp());
        log.info("[AUDIT] Persisted verified fallback credential on device {} ({})", device.getId(), device.getIp());
    }
    
    private static void refresh(Device target, Device saved) {
        target.setSettings(saved.getSettings());
        target.setVersion(saved.getVersion());
        target.setUpdatedAt(saved.getUpdatedAt());
    }
}
