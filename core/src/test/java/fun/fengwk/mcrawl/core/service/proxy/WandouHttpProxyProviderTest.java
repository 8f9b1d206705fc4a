package fun.fengwk.mcrawl.core.service.proxy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.mcrawl.core.configuration.ProxyProperties;
import fun.fengwk.mcrawl.core.exception.ProviderUnavailableException;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * @author fengwk
 */
public class WandouHttpProxyProviderTest {

    private static final String THREE_LEASES = "{\"code\":200,\"msg\":\"ok\",\"data\":["
        + "{\"ip\":\"1.1.1.1\",\"port\":8001,\"expire_time\":\"2099-01-01 00:00:00\"},"
        + "{\"ip\":\"2.2.2.2\",\"port\":8002,\"expire_time\":\"2099-01-01 00:00:00\"},"
        + "{\"ip\":\"3.3.3.3\",\"port\":8003,\"expire_time\":\"2099-01-01 00:00:00\"}]}";

    private HttpServer server;

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    public void shouldRequestLeasesWithAppKeyAndCount() throws Exception {
        AtomicReference<String> queryRef = new AtomicReference<>();
        server = startServer(exchange -> {
            queryRef.set(exchange.getRequestURI().getRawQuery());
            writeJson(exchange, THREE_LEASES);
        });
        WandouHttpProxyProvider provider = newProvider("key-1");

        List<ProxyLease> leases = provider.fetchLeases(2);

        assertThat(queryRef.get()).isEqualTo("app_key=key-1&num=2");
        assertThat(leases).hasSize(2);
        assertThat(leases.get(0).getIp()).isEqualTo("1.1.1.1");
        assertThat(leases.get(0).getPort()).isEqualTo(8001);
        assertThat(leases.get(0).getExpiresAt())
            .isEqualTo(LocalDateTime.of(2099, 1, 1, 0, 0).atZone(ZoneId.of("Asia/Shanghai")).toInstant());
    }

    @Test
    public void shouldServeSurplusLeasesFromCache() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        server = startServer(exchange -> {
            hits.incrementAndGet();
            writeJson(exchange, THREE_LEASES);
        });
        WandouHttpProxyProvider provider = newProvider("key-1");

        List<ProxyLease> first = provider.fetchLeases(1);
        List<ProxyLease> second = provider.fetchLeases(2);

        assertThat(hits.get()).isEqualTo(1);
        assertThat(first).extracting(ProxyLease::getIp).containsExactly("1.1.1.1");
        assertThat(second).extracting(ProxyLease::getIp).containsExactly("2.2.2.2", "3.3.3.3");
    }

    @Test
    public void shouldFailWithoutAppKey() {
        WandouHttpProxyProvider provider = new WandouHttpProxyProvider(new ProxyProperties.Wandou(),
            HttpClient.newHttpClient(), new ObjectMapper(), new ProxyLeaseCache("WANDOUHTTP", Duration.ofSeconds(5)));

        assertThatThrownBy(() -> provider.fetchLeases(1))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("app key");
    }

    @Test
    public void shouldMapErrorCodes() {
        WandouHttpProxyProvider provider = newProvider("key-1", "http://127.0.0.1:1/");

        assertThatThrownBy(() -> provider.parseLeases("{\"code\":10048,\"msg\":\"no package\"}"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("no available package");
        assertThatThrownBy(() -> provider.parseLeases("{\"code\":10001,\"msg\":\"bad key\"}"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("general error: bad key");
        assertThatThrownBy(() -> provider.parseLeases("<html>"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("invalid json");
    }

    @Test
    public void shouldSkipMalformedItems() {
        WandouHttpProxyProvider provider = newProvider("key-1", "http://127.0.0.1:1/");

        List<ProxyLease> leases = provider.parseLeases("{\"code\":200,\"data\":["
            + "{\"ip\":\"\",\"port\":8001},{\"ip\":\"4.4.4.4\",\"port\":8004}]}");

        assertThat(leases).extracting(ProxyLease::getIp).containsExactly("4.4.4.4");
        assertThat(leases.get(0).getExpiresAt()).isNull();
    }

    private WandouHttpProxyProvider newProvider(String appKey) {
        return newProvider(appKey, "http://127.0.0.1:" + server.getAddress().getPort() + "/");
    }

    private static WandouHttpProxyProvider newProvider(String appKey, String apiUrl) {
        ProxyProperties.Wandou wandou = new ProxyProperties.Wandou();
        wandou.setAppKey(appKey);
        wandou.setApiUrl(apiUrl);
        wandou.setTimeoutMs(2000);
        return new WandouHttpProxyProvider(wandou, HttpClient.newHttpClient(), new ObjectMapper(),
            new ProxyLeaseCache("WANDOUHTTP", Duration.ofSeconds(5)));
    }

    private static HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", handler);
        server.start();
        return server;
    }

    private static void writeJson(HttpExchange exchange, String json) throws IOException {
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        exchange.getResponseBody().write(bytes);
        exchange.close();
    }

}
