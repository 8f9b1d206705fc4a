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
public class JishuHttpProxyProviderTest {

    private static final String TWO_LEASES = "{\"code\":0,\"msg\":\"ok\",\"data\":["
        + "{\"ip\":\"1.1.1.1\",\"port\":8001,\"user\":\"u1\",\"pass\":\"p1\",\"expire\":\"2099-01-01 00:00:00\"},"
        + "{\"ip\":\"2.2.2.2\",\"port\":8002,\"user\":\"u2\",\"pass\":\"p2\",\"expire\":\"2099-01-01 00:00:00\"}]}";

    private HttpServer server;

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    public void shouldRequestCredentialedLeases() throws Exception {
        AtomicReference<String> queryRef = new AtomicReference<>();
        server = startServer(exchange -> {
            queryRef.set(exchange.getRequestURI().getRawQuery());
            writeJson(exchange, TWO_LEASES);
        });
        JishuHttpProxyProvider provider = newProvider("key-1", "sig+1");

        List<ProxyLease> leases = provider.fetchLeases(1);

        assertThat(queryRef.get())
            .isEqualTo("key=key-1&crypto=sig%2B1&time=30&type=json&port=1&pw=1&se=1&num=1");
        assertThat(leases).hasSize(1);
        ProxyLease lease = leases.get(0);
        assertThat(lease.getIp()).isEqualTo("1.1.1.1");
        assertThat(lease.getPort()).isEqualTo(8001);
        assertThat(lease.getUsername()).isEqualTo("u1");
        assertThat(lease.getPassword()).isEqualTo("p1");
        assertThat(lease.hasCredentials()).isTrue();
        assertThat(lease.getExpiresAt())
            .isEqualTo(LocalDateTime.of(2099, 1, 1, 0, 0).atZone(ZoneId.of("Asia/Shanghai")).toInstant());
    }

    @Test
    public void shouldServeSurplusLeasesFromCache() throws Exception {
        AtomicInteger hits = new AtomicInteger();
        server = startServer(exchange -> {
            hits.incrementAndGet();
            writeJson(exchange, TWO_LEASES);
        });
        JishuHttpProxyProvider provider = newProvider("key-1", "sig");

        List<ProxyLease> first = provider.fetchLeases(1);
        List<ProxyLease> second = provider.fetchLeases(1);

        assertThat(hits.get()).isEqualTo(1);
        assertThat(first).extracting(ProxyLease::getIp).containsExactly("1.1.1.1");
        assertThat(second).extracting(ProxyLease::getIp).containsExactly("2.2.2.2");
    }

    @Test
    public void shouldFailWithoutCredentialsConfigured() {
        JishuHttpProxyProvider provider = new JishuHttpProxyProvider(new ProxyProperties.Jishu(),
            HttpClient.newHttpClient(), new ObjectMapper(), new ProxyLeaseCache("JISUHTTP", Duration.ofSeconds(5)));

        assertThatThrownBy(() -> provider.fetchLeases(1))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("key or crypto");
    }

    @Test
    public void shouldRaiseApiMessageOnNonZeroCode() {
        JishuHttpProxyProvider provider = newProvider("key-1", "sig", "http://127.0.0.1:1/fetchips");

        assertThatThrownBy(() -> provider.parseLeases("{\"code\":1003,\"msg\":\"balance exhausted\"}"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("balance exhausted")
            .hasMessageContaining("1003");
        assertThatThrownBy(() -> provider.parseLeases("not json"))
            .isInstanceOf(ProviderUnavailableException.class)
            .hasMessageContaining("invalid json");
    }

    @Test
    public void shouldSkipItemsWithoutEndpoint() {
        JishuHttpProxyProvider provider = newProvider("key-1", "sig", "http://127.0.0.1:1/fetchips");

        List<ProxyLease> leases = provider.parseLeases("{\"code\":0,\"data\":["
            + "{\"ip\":\"3.3.3.3\",\"port\":0},{\"ip\":\"4.4.4.4\",\"port\":8004,\"expire\":\"soon\"}]}");

        assertThat(leases).extracting(ProxyLease::getIp).containsExactly("4.4.4.4");
        assertThat(leases.get(0).getExpiresAt()).isNull();
        assertThat(leases.get(0).hasCredentials()).isFalse();
    }

    private JishuHttpProxyProvider newProvider(String key, String crypto) {
        return newProvider(key, crypto, "http://127.0.0.1:" + server.getAddress().getPort() + "/fetchips");
    }

    private static JishuHttpProxyProvider newProvider(String key, String crypto, String apiUrl) {
        ProxyProperties.Jishu jishu = new ProxyProperties.Jishu();
        jishu.setKey(key);
        jishu.setCrypto(crypto);
        jishu.setApiUrl(apiUrl);
        jishu.setTimeoutMs(2000);
        return new JishuHttpProxyProvider(jishu, HttpClient.newHttpClient(), new ObjectMapper(),
            new ProxyLeaseCache("JISUHTTP", Duration.ofSeconds(5)));
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
