package com.platform.fleetsync.protocol;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.fleetsync.error.DeviceCommunicationException;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.error.DeviceProtocolException;
import com.platform.fleetsync.protocol.gen1.Gen1BasicClient;
import com.platform.fleetsync.protocol.gen2.Gen2RpcClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;

/**
 * Creates generation-specific clients and detects a device's generation.
 */
@Slf4j
@Component
public class DeviceClientFactory {
    
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProtocolProperties properties;
    
    public DeviceClientFactory(ObjectMapper objectMapper, ProtocolProperties properties) {
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(properties.getConnectTimeout())
            .followRedirects(HttpClient.Redirect.NEVER)
            .build();
        
        log.info("Device client factory initialized (connect timeout {})", properties.getConnectTimeout());
    }
    
    /**
     * @param credential null for devices without auth
     */
    public DeviceClient create(String ip, Generation generation, DeviceCredential credential) {
        return switch (generation) {
            case GEN1 -> new Gen1BasicClient(ip, credential, httpClient, objectMapper, properties);
            case GEN2 -> new Gen2RpcClient(ip, credential, httpClient, objectMapper, properties);
        };
    }
    
    /**
     * Detect the generation and return the unauthenticated identity the device reports.
     * The Gen2 RPC endpoint is tried first, then the Gen1 {@code /shelly} endpoint.
     * Network failures propagate; a device answering neither is a protocol error.
     */
    public DeviceInfo describe(CallContext ctx, String ip) {
        Gen2RpcClient gen2 = new Gen2RpcClient(ip, null, httpClient, objectMapper, properties);
        try {
            DeviceInfo info = gen2.fetchDeviceInfo(ctx);
            if (info.getGeneration() >= 2) {
                log.debug("Detected Gen{} device at {}", info.getGeneration(), ip);
                return info;
            }
        } catch (DeviceNetworkException e) {
            throw e;
        } catch (DeviceCommunicationException e) {
            log.debug("No Gen2 RPC endpoint at {}: {}", ip, e.getMessage());
        }
        
        DeviceInfo info = new Gen1BasicClient(ip, null, httpClient, objectMapper, properties).getInfo(ctx);
        if (info.getType() == null || info.getType().isBlank()) {
            throw DeviceProtocolException.malformed(ip, 0, "detect_generation",
                "device answered neither as Gen1 nor as Gen2", null);
        }
        log.debug("Detected Gen1 device {} at {}", info.getType(), ip);
        return info;
    }
}
