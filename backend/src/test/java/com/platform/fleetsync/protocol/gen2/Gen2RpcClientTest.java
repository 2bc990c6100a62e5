package com.platform.fleetsync.protocol.gen2;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.fleetsync.error.DeviceAuthException;
import com.platform.fleetsync.error.DeviceProtocolException;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.ProtocolProperties;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs the RPC client against an in-process fake device that enforces digest auth.
 */
class Gen2RpcClientTest {

    private static final Pattern PARAM = Pattern.compile("(\\w+)=(\"([^\"]*)\"|[^,\\s]+)");
    private static final String REALM = "shellyplus1-a8032ab12345";

    private HttpServer server;
    private final AtomicInteger requests = new AtomicInteger();
    private volatile String nonce = "nonce-1";
    private volatile String staleNonceOnce;
    private volatile boolean alwaysStale;
    private volatile String password = "secret";

    @BeforeEach
    void startDevice() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/rpc", this::handle);
        server.start();
    }

    @AfterEach
    void stopDevice() {
        server.stop(0);
    }

    @Test
    void rpc_withValidCredential_answersChallenge() {
        Gen2RpcClient client = client(new DeviceCredential("admin", "secret"));

        JsonNode result = client.rpc(CallContext.root(), "Shelly.GetStatus", null);

        assertThat(result.path("sys").path("uptime").asInt()).isEqualTo(42);
        assertThat(requests).hasValue(2);
    }

    @Test
    void rpc_withStaleNonce_retriesExactlyOnce() {
        staleNonceOnce = "nonce-2";
        Gen2RpcClient client = client(new DeviceCredential("admin", "secret"));

        JsonNode result = client.rpc(CallContext.root(), "Shelly.GetStatus", null);

        assertThat(result.path("sys").path("uptime").asInt()).isEqualTo(42);
        assertThat(requests).hasValue(3);
    }

    @Test
    void rpc_withRepeatedStaleNonce_givesUpAfterOneRetry() {
        alwaysStale = true;
        Gen2RpcClient client = client(new DeviceCredential("admin", "secret"));

        assertThatThrownBy(() -> client.rpc(CallContext.root(), "Shelly.GetStatus", null))
            .isInstanceOf(DeviceAuthException.class)
            .extracting(e -> ((DeviceAuthException) e).getErrorCode())
            .isEqualTo(ErrorCode.DEVICE_AUTH_FAILED);
        assertThat(requests).hasValue(3);
    }

    @Test
    void rpc_withWrongPassword_isRejected() {
        password = "other";
        Gen2RpcClient client = client(new DeviceCredential("admin", "secret"));

        assertThatThrownBy(() -> client.rpc(CallContext.root(), "Shelly.GetStatus", null))
            .isInstanceOf(DeviceAuthException.class)
            .extracting(e -> ((DeviceAuthException) e).getErrorCode())
            .isEqualTo(ErrorCode.DEVICE_AUTH_FAILED);
        assertThat(requests).hasValue(2);
    }

    @Test
    void rpc_withoutCredential_reportsAuthRequired() {
        Gen2RpcClient client = client(null);

        assertThatThrownBy(() -> client.testConnection(CallContext.root()))
            .isInstanceOf(DeviceAuthException.class)
            .extracting(e -> ((DeviceAuthException) e).getErrorCode())
            .isEqualTo(ErrorCode.DEVICE_AUTH_REQUIRED);
        assertThat(requests).hasValue(1);
    }

    @Test
    void rpc_withErrorEnvelope_raisesProtocolError() {
        Gen2RpcClient client = client(new DeviceCredential("admin", "secret"));

        assertThatThrownBy(() -> client.rpc(CallContext.root(), "Switch.Set", null))
            .isInstanceOf(DeviceProtocolException.class)
            .hasMessageContaining("Switch.Set");
    }

    @Test
    void fetchDeviceInfo_readsUnauthenticatedIdentity() {
        Gen2RpcClient client = client(null);

        DeviceInfo info = client.fetchDeviceInfo(CallContext.root());

        assertThat(info.getGeneration()).isEqualTo(2);
        assertThat(info.getMac()).isEqualTo("A8032AB12345");
        assertThat(info.isAuthEnabled()).isTrue();
    }

    private Gen2RpcClient client(DeviceCredential credential) {
        return new Gen2RpcClient("127.0.0.1:" + server.getAddress().getPort(), credential,
            HttpClient.newHttpClient(), new ObjectMapper(), new ProtocolProperties());
    }

    private void handle(HttpExchange exchange) throws IOException {
        requests.incrementAndGet();
        String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);

        if ("GET".equals(exchange.getRequestMethod())) {
            respond(exchange, 200, "{\"id\":\"shellyplus1-a8032ab12345\",\"mac\":\"A8032AB12345\","
                + "\"model\":\"SNSW-001X16EU\",\"gen\":2,\"ver\":\"1.0.8\",\"auth_en\":true}");
            return;
        }

        String authorization = exchange.getRequestHeaders().getFirst("Authorization");
        if (authorization == null) {
            challenge(exchange, false);
            return;
        }
        Map<String, String> params = params(authorization.substring("Digest ".length()));
        if (alwaysStale) {
            nonce = "nonce-" + requests.get();
            challenge(exchange, true);
            return;
        }
        if (staleNonceOnce != null && nonce.equals(params.get("nonce"))) {
            nonce = staleNonceOnce;
            staleNonceOnce = null;
            challenge(exchange, true);
            return;
        }
        if (!nonce.equals(params.get("nonce")) || !expectedResponse(params).equals(params.get("response"))) {
            challenge(exchange, false);
            return;
        }

        if (body.contains("\"Switch.Set\"")) {
            respond(exchange, 200, "{\"id\":1,\"error\":{\"code\":-103,\"message\":\"Invalid argument\"}}");
        } else {
            respond(exchange, 200, "{\"id\":1,\"result\":{\"sys\":{\"uptime\":42}}}");
        }
    }

    private String expectedResponse(Map<String, String> params) {
        String ha1 = DigestAuthenticator.hash("SHA-256", "admin:" + REALM + ":" + password);
        String ha2 = DigestAuthenticator.hash("SHA-256", "POST:" + params.get("uri"));
        return DigestAuthenticator.hash("SHA-256", ha1 + ":" + nonce + ":" + params.get("nc") + ":"
            + params.get("cnonce") + ":auth:" + ha2);
    }

    private void challenge(HttpExchange exchange, boolean stale) throws IOException {
        exchange.getResponseHeaders().add("WWW-Authenticate", "Digest qop=\"auth\", realm=\"" + REALM
            + "\", nonce=\"" + nonce + "\", algorithm=SHA-256" + (stale ? ", stale=true" : ""));
        respond(exchange, 401, "");
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        }
        exchange.close();
    }

    private static Map<String, String> params(String header) {
        Map<String, String> params = new HashMap<>();
        Matcher matcher = PARAM.matcher(header);
        while (matcher.find()) {
            params.put(matcher.group(1), matcher.group(3) != null ? matcher.group(3) : matcher.group(2));
        }
        return params;
    }
}
