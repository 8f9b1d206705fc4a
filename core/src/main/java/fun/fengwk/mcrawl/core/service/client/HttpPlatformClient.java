package fun.fengwk.mcrawl.core.service.client;

import fun.fengwk.mcrawl.core.exception.BlockedException;
import fun.fengwk.mcrawl.core.exception.ItemWithdrawnException;
import fun.fengwk.mcrawl.core.exception.NotFoundException;
import fun.fengwk.mcrawl.core.exception.PlatformRequestException;
import fun.fengwk.mcrawl.core.exception.TransientRequestException;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.login.SessionState;
import fun.fengwk.mcrawl.core.service.proxy.ProxyHttpClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

/**
 * {@link PlatformClient} on top of the jdk http client.
 *
 * @author fengwk
 */
@Slf4j
public class HttpPlatformClient implements PlatformClient {

    public static final Set<Integer> DEFAULT_BLOCKED_STATUS_CODES = Set.of(403, 429, 461, 471);

    private final Platform platform;
    private final String baseUrl;
    private final Signer signer;
    private final SessionState session;
    private final Map<String, String> defaultHeaders;
    private final Set<Integer> blockedStatusCodes;
    private final Duration timeout;
    private final ProxyHttpClients httpClients;

    public HttpPlatformClient(Platform platform, String baseUrl, Signer signer, SessionState session,
                              Map<String, String> defaultHeaders, long timeoutMs) {
        this(platform, baseUrl, signer, session, defaultHeaders, DEFAULT_BLOCKED_STATUS_CODES, timeoutMs);
    }

    public HttpPlatformClient(Platform platform, String baseUrl, Signer signer, SessionState session,
                              Map<String, String> defaultHeaders, Set<Integer> blockedStatusCodes, long timeoutMs) {
        this(platform, baseUrl, signer, session, defaultHeaders, blockedStatusCodes, timeoutMs,
            new ProxyHttpClients(Duration.ofMillis(Math.max(1, timeoutMs))));
    }

    /**
     * @param httpClients per-lease clients, may be shared with other platform clients
     */
    public HttpPlatformClient(Platform platform, String baseUrl, Signer signer, SessionState session,
                              Map<String, String> defaultHeaders, Set<Integer> blockedStatusCodes, long timeoutMs,
                              ProxyHttpClients httpClients) {
        this.platform = platform;
        this.baseUrl = trimTrailingSlash(baseUrl);
        this.signer = signer == null ? Signer.NONE : signer;
        this.session = session;
        this.defaultHeaders = defaultHeaders == null ? Map.of() : Map.copyOf(defaultHeaders);
        this.blockedStatusCodes = Set.copyOf(blockedStatusCodes);
        this.timeout = Duration.ofMillis(Math.max(1, timeoutMs));
        this.httpClients = httpClients;
    }

    @Override
    public PlatformResponse request(PlatformRequest request, ProxyLease lease) {
        URI uri = buildUri(request);
        HttpRequest httpRequest = buildHttpRequest(request, uri);
        HttpClient client = httpClients.clientFor(lease);

        HttpResponse<String> response;
        try {
            response = client.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new TransientRequestException("request interrupted, uri=" + uri.getPath(), ex);
        } catch (IOException ex) {
            throw new TransientRequestException("request failed, uri=" + uri.getPath() + ", error=" + ex.getMessage(), ex);
        }
        if (lease != null && blockedStatusCodes.contains(response.statusCode())) {
            // a blocked lease is evicted by its task and never used again
            httpClients.release(lease);
        }
        return classify(uri, response.statusCode(), response.body());
    }

    private PlatformResponse classify(URI uri, int status, String body) {
        if (status >= 200 && status < 300) {
            return new PlatformResponse(status, body);
        }
        String message = "platform=" + platform.getCode() + ", uri=" + uri.getPath() + ", status=" + status;
        if (blockedStatusCodes.contains(status)) {
            throw new BlockedException("request blocked, " + message);
        }
        if (status == 410) {
            throw new ItemWithdrawnException("item withdrawn, " + message);
        }
        if (status == 404) {
            throw new NotFoundException("item not found, " + message);
        }
        if (status >= 500) {
            throw new TransientRequestException("server error, " + message);
        }
        throw new PlatformRequestException("request rejected, " + message);
    }

    private HttpRequest buildHttpRequest(PlatformRequest request, URI uri) {
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri).timeout(timeout);

        Map<String, String> headers = new LinkedHashMap<>(defaultHeaders);
        if (request.getHeaders() != null) {
            headers.putAll(request.getHeaders());
        }
        if (session != null) {
            String cookieHeader = session.cookieHeader();
            if (StringUtils.hasText(cookieHeader)) {
                headers.put("Cookie", cookieHeader);
            }
        }
        Map<String, String> signed = signer.sign(request, session);
        if (signed != null) {
            headers.putAll(signed);
        }
        headers.forEach((name, value) -> {
            if (StringUtils.hasText(name) && value != null) {
                builder.header(name, value);
            }
        });

        if (request.getMethod() == RequestMethod.POST) {
            builder.header("Content-Type", "application/json;charset=UTF-8");
            String body = request.getBody() == null ? "" : request.getBody();
            builder.POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        } else {
            builder.GET();
        }
        return builder.build();
    }

    private URI buildUri(PlatformRequest request) {
        String target = request.getUri() == null ? "" : request.getUri();
        String url = target.startsWith("http://") || target.startsWith("https://")
            ? target
            : baseUrl + (target.startsWith("/") ? target : "/" + target);
        String query = encodeQuery(request.getParams());
        if (!query.isEmpty()) {
            url = url + (url.contains("?") ? "&" : "?") + query;
        }
        return URI.create(url);
    }

    private String encodeQuery(Map<String, String> params) {
        if (params == null || params.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("&");
        params.forEach((key, value) -> {
            if (key == null || value == null) {
                return;
            }
            joiner.add(URLEncoder.encode(key, StandardCharsets.UTF_8) + "=" + URLEncoder.encode(value, StandardCharsets.UTF_8));
        });
        return joiner.toString();
    }

    private String trimTrailingSlash(String url) {
        if (url == null) {
            return "";
        }
        String trimmed = url.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }

}
