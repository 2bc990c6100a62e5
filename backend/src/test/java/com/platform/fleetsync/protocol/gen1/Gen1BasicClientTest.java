package com.platform.fleetsync.protocol.gen1;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.fleetsync.error.DeviceAuthException;
import com.platform.fleetsync.error.DeviceNetworkException;
import com.platform.fleetsync.error.ErrorCode;
import com.platform.fleetsync.protocol.CallContext;
import com.platform.fleetsync.protocol.DeviceCredential;
import com.platform.fleetsync.protocol.DeviceInfo;
import com.platform.fleetsync.protocol.DeviceStatus;
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
import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Gen1BasicClientTest {

    private static final String EXPECTED_AUTH = "Basic "
        + Base64.getEncoder().encodeToString("admin:secret".getBytes(StandardCharsets.UTF_8));

    private HttpServer server;
    private final List<String> paths = new CopyOnWriteArrayList<>();

    @BeforeEach
    void startDevice() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/", this::handle);
        server.start();
    }

    @AfterEach
    void stopDevice() {
        server.stop(0);
    }

    @Test
    void getInfo_isReadableWithoutCredential() {
        DeviceInfo info = client(null).getInfo(CallContext.root());

        assertThat(info.getType()).isEqualTo("SHSW-1");
        assertThat(info.getMac()).isEqualTo("A4CF12F45678");
        assertThat(info.isAuthEnabled()).isTrue();
        assertThat(info.getGeneration()).isEqualTo(1);
    }

    @Test
    void getStatus_withCredential_mapsRelays() {
        DeviceStatus status = client(new DeviceCredential("admin", "secret")).getStatus(CallContext.root());

        assertThat(status.getSwitches()).hasSize(1);
        assertThat(status.getSwitches().get(0).output()).isTrue();
        assertThat(status.getWifiSsid()).isEqualTo("iot");
    }

    @Test
    void testConnection_withWrongPassword_isRejected() {
        Gen1BasicClient client = client(new DeviceCredential("admin", "wrong"));

        assertThatThrownBy(() -> client.testConnection(CallContext.root()))
            .isInstanceOf(DeviceAuthException.class)
            .extracting(e -> ((DeviceAuthException) e).getErrorCode())
            .isEqualTo(ErrorCode.DEVICE_AUTH_FAILED);
    }

    @Test
    void testConnection_withoutCredential_reportsAuthRequired() {
        assertThatThrownBy(() -> client(null).testConnection(CallContext.root()))
            .isInstanceOf(DeviceAuthException.class)
            .extracting(e -> ((DeviceAuthException) e).getErrorCode())
            .isEqualTo(ErrorCode.DEVICE_AUTH_REQUIRED);
    }

    @Test
    void setComponentState_switchOn_hitsRelayEndpoint() {
        client(new DeviceCredential("admin", "secret")).setComponentState(CallContext.root(), "switch", 0, "on");

        assertThat(paths).contains("/relay/0?turn=on");
    }

    @Test
    void call_onCancelledContext_failsWithoutRequest() {
        CallContext ctx = CallContext.root().withTimeout(Duration.ofSeconds(5));
        ctx.cancel();

        assertThatThrownBy(() -> client(null).getInfo(ctx))
            .isInstanceOf(DeviceNetworkException.class);
        assertThat(paths).isEmpty();
    }

    private Gen1BasicClient client(DeviceCredential credential) {
        return new Gen1BasicClient("127.0.0.1:" + server.getAddress().getPort(), credential,
            HttpClient.newHttpClient(), new ObjectMapper(), new ProtocolProperties());
    }

    private void handle(HttpExchange exchange) throws IOException {
        String path = exchange.getRequestURI().toString();
        paths.add(path);
        if (path.startsWith("/shelly")) {
            respond(exchange, 200, "{\"type\":\"SHSW-1\",\"mac\":\"A4CF12F45678\",\"auth\":true,\"fw\":\"20230913-112003\"}");
            return;
        }
        if (!EXPECTED_AUTH.equals(exchange.getRequestHeaders().getFirst("Authorization"))) {
            respond(exchange, 401, "");
            return;
        }
        if (path.startsWith("/status")) {
            respond(exchange, 200, "{\"wifi_sta\":{\"connected\":true,\"ssid\":\"iot\",\"rssi\":-60},"
                + "\"relays\":[{\"ison\":true}],\"meters\":[{\"power\":12.5}],\"uptime\":100}");
            return;
        }
        respond(exchange, 200, "{\"ison\":true}");
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
}
