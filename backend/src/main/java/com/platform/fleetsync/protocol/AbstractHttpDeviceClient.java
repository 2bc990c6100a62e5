package com.platform.fleetsync.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.error.DeviceProtocolException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Shared HTTP transport for both generations: deadline and cancellation
 * handling, plus classification of transport failures.
 */
@Slf4j
public abstract class AbstractHttpDeviceClient implements DeviceClient {
    
    protected final String ip;
    protected final DeviceCredential credential;
    protected final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    protected final ProtocolProperties properties;
    
    protected AbstractHttpDeviceClient(String ip, DeviceCredential credential, HttpClient httpClient,
            ObjectMapper objectMapper, ProtocolProperties properties) {
        this.ip = ip;
        this.credential = credential;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }
    
    @Override
    public String ip() {
        return ip;
    }
    
    @Override
    public void setComponentState(CallContext ctx, String component, int channel, String value) {
        execute(ctx, ComponentCommand.parse(component, channel, value));
    }
    
    protected abstract void execute(CallContext ctx, ComponentCommand command);
    
    protected URI uri(String pathAndQuery) {
        return URI.create("http://" + ip + pathAndQuery);
    }
    
    protected HttpRequest.Builder request(CallContext ctx, String pathAndQuery) {
        Duration remaining = ctx.remaining();
        return HttpRequest.newBuilder()
            .uri(uri(pathAndQuery))
            .header("User-Agent", properties.getUserAgent())
            .timeout(remaining.isZero() ? Duration.ofMillis(1) : remaining);
    }
    
    /**
     * Send a request bound to the context's deadline. Cancelling the context aborts the exchange.
     */
    protected HttpResponse<String> send(CallContext ctx, String operation, HttpRequest request) {
        int gen = generation().number();
        if (ctx.isCancelled()) {
            throw DeviceNetworkException.cancelled(ip, gen, operation);
        }
        Duration remaining = ctx.remaining();
        if (remaining.isZero()) {
            throw DeviceNetworkException.timeout(ip, gen, operation);
        }
        
        CompletableFuture<HttpResponse<String>> future =
            httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString());
        Runnable unregister = ctx.onCancel(() -> future.cancel(true));
        try {
            return future.get(remaining.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw DeviceNetworkException.timeout(ip, gen, operation);
        } catch (CancellationException e) {
            throw DeviceNetworkException.cancelled(ip, gen, operation);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw DeviceNetworkException.cancelled(ip, gen, operation);
        } catch (ExecutionException e) {
            throw classify(operation, e.getCause());
        } finally {
            unregister.run();
        }
    }
    
    private DeviceNetworkException classify(String operation, Throwable cause) {
        int gen = generation().number();
        if (cause instanceof HttpTimeoutException) {
            return DeviceNetworkException.timeout(ip, gen, operation);
        }
        if (cause instanceof ConnectException || cause instanceof IOException) {
            return DeviceNetworkException.unreachable(ip, gen, operation, cause);
        }
        log.debug("Unclassified transport failure for {} on {}", operation, ip, cause);
        return DeviceNetworkException.unreachable(ip, gen, operation, cause);
    }
    
    protected JsonNode readJson(String operation, String body) {
        if (body == null || body.isBlank()) {
            throw DeviceProtocolException.malformed(ip, generation().number(), operation, "empty response body", null);
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw DeviceProtocolException.malformed(ip, generation().number(), operation,
                "response is not valid JSON", e);
        }
    }
    
    protected static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
