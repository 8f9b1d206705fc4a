package fun.fengwk.mcrawl.core.service.client;

import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.mcrawl.core.exception.BlockedException;
import fun.fengwk.mcrawl.core.exception.ItemWithdrawnException;
import fun.fengwk.mcrawl.core.exception.NotFoundException;
import fun.fengwk.mcrawl.core.exception.PlatformRequestException;
import fun.fengwk.mcrawl.core.exception.TransientRequestException;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.login.SessionState;
import fun.fengwk.mcrawl.core.service.proxy.ProxyHttpClients;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.net.InetSocketAddress;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class HttpPlatformClientTest {

    private HttpServer server;

    @AfterEach
    public void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    public void shouldSendCookiesSignatureAndQuery() throws Exception {
        AtomicReference<Headers> headersRef = new AtomicReference<>();
        AtomicReference<String> queryRef = new AtomicReference<>();
        server = startServer(exchange -> {
            headersRef.set(exchange.getRequestHeaders());
            queryRef.set(exchange.getRequestURI().getRawQuery());
            write(exchange, 200, "{\"ok\":true}");
        });
        SessionState session = mock(SessionState.class);
        when(session.cookieHeader()).thenReturn("a1=xyz; web_session=abc");
        Signer signer = (request, state) -> Map.of("X-Sign", "sig-" + request.getParams().get("keyword"));
        HttpPlatformClient client = new HttpPlatformClient(Platform.XHS, baseUrl() + "/", signer, session,
            Map.of("User-Agent", "test-agent"), 2000);

        PlatformResponse response = client.request(PlatformRequest.builder()
            .uri("/api/search")
            .params(Map.of("keyword", "coffee shop"))
            .build(), null);

        assertThat(response.statusCode()).isEqualTo(200);
        assertThat(response.body()).contains("ok");
        assertThat(queryRef.get()).isEqualTo("keyword=coffee+shop");
        assertThat(headersRef.get().getFirst("Cookie")).isEqualTo("a1=xyz; web_session=abc");
        assertThat(headersRef.get().getFirst("X-Sign")).isEqualTo("sig-coffee shop");
        assertThat(headersRef.get().getFirst("User-Agent")).isEqualTo("test-agent");
    }

    @Test
    public void shouldPostJsonBody() throws Exception {
        AtomicReference<String> bodyRef = new AtomicReference<>();
        AtomicReference<String> methodRef = new AtomicReference<>();
        server = startServer(exchange -> {
            methodRef.set(exchange.getRequestMethod());
            bodyRef.set(readBody(exchange));
            write(exchange, 200, "{}");
        });
        HttpPlatformClient client = new HttpPlatformClient(Platform.XHS, baseUrl(), null, null, Map.of(), 2000);

        client.request(PlatformRequest.builder()
            .method(RequestMethod.POST)
            .uri("api/comment")
            .body("{\"note_id\":\"n1\"}")
            .build(), null);

        assertThat(methodRef.get()).isEqualTo("POST");
        assertThat(bodyRef.get()).isEqualTo("{\"note_id\":\"n1\"}");
    }

    @Test
    public void shouldClassifyFailureStatuses() throws Exception {
        server = startServer(exchange -> {
            String path = exchange.getRequestURI().getPath();
            write(exchange, Integer.parseInt(path.substring(path.lastIndexOf('/') + 1)), "");
        });
        HttpPlatformClient client = new HttpPlatformClient(Platform.DOUYIN, baseUrl(), null, null, Map.of(), 2000);

        assertThatThrownBy(() -> client.request(get("/status/461"), null)).isInstanceOf(BlockedException.class);
        assertThatThrownBy(() -> client.request(get("/status/429"), null)).isInstanceOf(BlockedException.class);
        assertThatThrownBy(() -> client.request(get("/status/404"), null)).isInstanceOf(NotFoundException.class);
        assertThatThrownBy(() -> client.request(get("/status/410"), null)).isInstanceOf(ItemWithdrawnException.class);
        assertThatThrownBy(() -> client.request(get("/status/503"), null)).isInstanceOf(TransientRequestException.class);
        assertThatThrownBy(() -> client.request(get("/status/400"), null))
            .isInstanceOf(PlatformRequestException.class)
            .hasMessageContaining("status=400");
    }

    @Test
    public void shouldTreatConnectionFailureAsTransient() {
        HttpPlatformClient client = new HttpPlatformClient(Platform.DOUYIN, "http://127.0.0.1:1", null, null,
            Map.of(), 1000);

        assertThatThrownBy(() -> client.request(get("/any"), null)).isInstanceOf(TransientRequestException.class);
    }

    @Test
    public void shouldReuseOneHttpClientPerLease() throws Exception {
        AtomicInteger requests = new AtomicInteger();
        AtomicReference<String> hostRef = new AtomicReference<>();
        server = startServer(exchange -> {
            requests.incrementAndGet();
            hostRef.set(exchange.getRequestHeaders().getFirst("Host"));
            write(exchange, 200, "{}");
        });
        ProxyHttpClients httpClients = new ProxyHttpClients(Duration.ofSeconds(2));
        HttpPlatformClient client = new HttpPlatformClient(Platform.XHS, "http://platform.test", null, null,
            Map.of(), HttpPlatformClient.DEFAULT_BLOCKED_STATUS_CODES, 2000, httpClients);
        ProxyLease lease = localLease();
        HttpClient leaseClient = httpClients.clientFor(lease);

        for (int i = 0; i < 5; i++) {
            client.request(get("/api/feed"), lease);
        }

        assertThat(requests.get()).isEqualTo(5);
        assertThat(hostRef.get()).isEqualTo("platform.test");
        assertThat(httpClients.size()).isEqualTo(1);
        assertThat(httpClients.clientFor(lease)).isSameAs(leaseClient);
    }

    @Test
    public void shouldDropClientOfBlockedLease() throws Exception {
        server = startServer(exchange -> write(exchange, 461, ""));
        ProxyHttpClients httpClients = new ProxyHttpClients(Duration.ofSeconds(2));
        HttpPlatformClient client = new HttpPlatformClient(Platform.XHS, "http://platform.test", null, null,
            Map.of(), HttpPlatformClient.DEFAULT_BLOCKED_STATUS_CODES, 2000, httpClients);
        ProxyLease lease = localLease();

        assertThatThrownBy(() -> client.request(get("/api/feed"), lease)).isInstanceOf(BlockedException.class);
        assertThat(httpClients.size()).isZero();
    }

    private ProxyLease localLease() {
        return ProxyLease.builder().ip("127.0.0.1").port(server.getAddress().getPort()).build();
    }

    private static PlatformRequest get(String uri) {
        return PlatformRequest.builder().uri(uri).build();
    }

    private String baseUrl() {
        return "http://127.0.0.1:" + server.getAddress().getPort();
    }

    private static HttpServer startServer(HttpHandler handler) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", handler);
        server.start();
        return server;
    }

    private static void write(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        if (bytes.length > 0) {
            exchange.getResponseBody().write(bytes);
        }
        exchange.close();
    }

    private static String readBody(HttpExchange exchange) throws IOException {
        try (InputStream input = exchange.getRequestBody()) {
            return new String(input.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

}
