package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * Probes a lease with a GET of an echo endpoint through the proxy.
 *
 * @author fengwk
 */
@Slf4j
public class HttpProxyValidator implements ProxyValidator {

    private final URI validateUri;
    private final Duration timeout;
    private final ProxyHttpClients httpClients;

    public HttpProxyValidator(String validateUrl, long timeoutMs) {
        this(validateUrl, timeoutMs, new ProxyHttpClients(Duration.ofMillis(Math.max(1, timeoutMs))));
    }

    /**
     * @param httpClients per-lease clients, a valid lease keeps its client for the requests that follow
     */
    public HttpProxyValidator(String validateUrl, long timeoutMs, ProxyHttpClients httpClients) {
        this.validateUri = URI.create(validateUrl);
        this.timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        this.httpClients = httpClients;
    }

    @Override
    public boolean validate(ProxyLease lease) {
        boolean valid = check(lease);
        if (!valid) {
            httpClients.release(lease);
        }
        return valid;
    }

    private boolean check(ProxyLease lease) {
        HttpClient client = httpClients.clientFor(lease);
        HttpRequest request = HttpRequest.newBuilder(validateUri)
            .timeout(timeout)
            .GET()
            .build();
        try {
            HttpResponse<Void> response = client.send(request, HttpResponse.BodyHandlers.discarding());
            boolean valid = response.statusCode() == 200;
            if (!valid) {
                log.info("proxy probe rejected, proxy={}, status={}", lease.address(), response.statusCode());
            }
            return valid;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            log.info("proxy probe interrupted, proxy={}", lease.address());
            return false;
        } catch (IOException ex) {
            log.info("proxy probe failed, proxy={}, error={}", lease.address(), ex.getMessage());
            return false;
        }
    }

}
