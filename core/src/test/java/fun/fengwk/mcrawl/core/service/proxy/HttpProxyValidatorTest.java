package fun.fengwk.mcrawl.core.service.proxy;

import com.sun.net.httpserver.HttpServer;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class HttpProxyValidatorTest {

    private HttpServer proxy;

    @AfterEach
    public void tearDown() {
        if (proxy != null) {
            proxy.stop(0);
        }
    }

    @Test
    public void shouldAcceptLeaseWhenProbeReturnsOk() throws Exception {
        AtomicReference<String> hostRef = new AtomicReference<>();
        proxy = startProxy(200, hostRef);
        HttpProxyValidator validator = new HttpProxyValidator("http://probe.test/echo", 2000);

        boolean valid = validator.validate(localLease(proxy.getAddress().getPort()));

        assertThat(valid).isTrue();
        assertThat(hostRef.get()).isEqualTo("probe.test");
    }

    @Test
    public void shouldRejectLeaseWhenProbeStatusIsNotOk() throws Exception {
        proxy = startProxy(502, new AtomicReference<>());
        HttpProxyValidator validator = new HttpProxyValidator("http://probe.test/echo", 2000);

        assertThat(validator.validate(localLease(proxy.getAddress().getPort()))).isFalse();
    }

    @Test
    public void shouldRejectUnreachableLease() throws Exception {
        int closedPort;
        try (ServerSocket socket = new ServerSocket(0)) {
            closedPort = socket.getLocalPort();
        }
        HttpProxyValidator validator = new HttpProxyValidator("http://probe.test/echo", 1000);

        assertThat(validator.validate(localLease(closedPort))).isFalse();
    }

    @Test
    public void shouldSendLeaseCredentialsToTunnelingProxy() throws Exception {
        List<String> authorizations = new CopyOnWriteArrayList<>();
        try (ServerSocket tunnelProxy = startTunnelProxy(authorizations)) {
            ProxyLease lease = ProxyLease.builder()
                .ip("127.0.0.1")
                .port(tunnelProxy.getLocalPort())
                .username("user")
                .password("secret")
                .build();
            HttpProxyValidator validator = new HttpProxyValidator("https://check.test/echo", 2000);

            // the tunnel is closed once credentials arrive, so the lease still fails
            assertThat(validator.validate(lease)).isFalse();
        }

        String expected = "Basic " + Base64.getEncoder()
            .encodeToString("user:secret".getBytes(StandardCharsets.UTF_8));
        assertThat(authorizations).contains(expected);
    }

    private static ProxyLease localLease(int port) {
        return ProxyLease.builder().ip("127.0.0.1").port(port).build();
    }

    private static HttpServer startProxy(int status, AtomicReference<String> hostRef) throws IOException {
        HttpServer server = HttpServer.create(new InetSocketAddress(0), 0);
        server.createContext("/", exchange -> {
            hostRef.set(exchange.getRequestHeaders().getFirst("Host"));
            exchange.sendResponseHeaders(status, -1);
            exchange.close();
        });
        server.start();
        return server;
    }

    /**
     * Answers CONNECT with a Basic challenge and records the Proxy-Authorization of the retry.
     */
    private static ServerSocket startTunnelProxy(List<String> authorizations) throws IOException {
        ServerSocket serverSocket = new ServerSocket(0);
        Thread acceptor = new Thread(() -> {
            while (!serverSocket.isClosed()) {
                try {
                    Socket socket = serverSocket.accept();
                    Thread handler = new Thread(() -> serveTunnel(socket, authorizations));
                    handler.setDaemon(true);
                    handler.start();
                } catch (IOException ex) {
                    return;
                }
            }
        });
        acceptor.setDaemon(true);
        acceptor.start();
        return serverSocket;
    }

    private static void serveTunnel(Socket socket, List<String> authorizations) {
        try (socket) {
            BufferedReader reader = new BufferedReader(
                new InputStreamReader(socket.getInputStream(), StandardCharsets.ISO_8859_1));
            OutputStream out = socket.getOutputStream();
            while (true) {
                String requestLine = reader.readLine();
                if (requestLine == null) {
                    return;
                }
                String authorization = null;
                String line;
                while ((line = reader.readLine()) != null && !line.isEmpty()) {
                    int colon = line.indexOf(':');
                    if (colon > 0 && line.substring(0, colon).trim().equalsIgnoreCase("Proxy-Authorization")) {
                        authorization = line.substring(colon + 1).trim();
                    }
                }
                if (authorization != null) {
                    authorizations.add(authorization);
                    return;
                }
                out.write(("HTTP/1.1 407 Proxy Authentication Required\r\n"
                    + "Proxy-Authenticate: Basic realm=\"crawl\"\r\n"
                    + "Content-Length: 0\r\n\r\n").getBytes(StandardCharsets.ISO_8859_1));
                out.flush();
            }
        } catch (IOException ex) {
            // client gave up on the tunnel
        }
    }

}
