package fun.fengwk.mcrawl.core.service.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.mcrawl.core.configuration.ProxyProperties;
import fun.fengwk.mcrawl.core.exception.ProviderUnavailableException;
import fun.fengwk.mcrawl.core.model.ProxyLease;
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
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Provider backed by the wandou http extraction api.
 *
 * @author fengwk
 */
@Slf4j
public class WandouHttpProxyProvider implements ProxyProvider {

    static final int MAX_BATCH = 100;

    private static final DateTimeFormatter EXPIRE_TIME_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int CODE_OK = 200;
    private static final int CODE_GENERAL_ERROR = 10001;
    private static final int CODE_NO_PACKAGE = 10048;

    private final ProxyProperties.Wandou properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProxyLeaseCache leaseCache;
    private final ZoneId zoneId;

    public WandouHttpProxyProvider(ProxyProperties.Wandou properties, HttpClient httpClient,
                                   ObjectMapper objectMapper, ProxyLeaseCache leaseCache) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.leaseCache = leaseCache;
        this.zoneId = ZoneId.of(properties.getZoneId());
    }

    @Override
    public String name() {
        return "wandouhttp";
    }

    @Override
    public List<ProxyLease> fetchLeases(int count) {
        int wanted = Math.min(Math.max(1, count), MAX_BATCH);
        List<ProxyLease> result = new ArrayList<>(leaseCache.drain(wanted));
        if (result.size() >= wanted) {
            log.debug("wandou leases served from cache, count={}", result.size());
            return result;
        }

        List<ProxyLease> fetched = requestLeases(wanted - result.size());
        for (ProxyLease lease : fetched) {
            leaseCache.put(lease);
        }
        result.addAll(leaseCache.drain(wanted - result.size()));
        return result;
    }

    private List<ProxyLease> requestLeases(int num) {
        if (!StringUtils.hasText(properties.getAppKey())) {
            throw new ProviderUnavailableException("wandou app key is not configured");
        }
        String url = properties.getApiUrl()
            + "?app_key=" + URLEncoder.encode(properties.getAppKey(), StandardCharsets.UTF_8)
            + "&num=" + num;
        HttpRequest request = HttpRequest.newBuilder(URI.create(url))
            .timeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
            .GET()
            .build();

        String body;
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new ProviderUnavailableException("wandou api http status " + response.statusCode());
            }
            body = response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("wandou api interrupted", ex);
        } catch (IOException ex) {
            throw new ProviderUnavailableException("wandou api request failed: " + ex.getMessage(), ex);
        }
        return parseLeases(body);
    }

    List<ProxyLease> parseLeases(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderUnavailableException("wandou api returned invalid json", ex);
        }
        int code = root.path("code").asInt(-1);
        if (code != CODE_OK) {
            String msg = root.path("msg").asText("");
            if (code == CODE_NO_PACKAGE) {
                throw new ProviderUnavailableException("wandou account has no available package (code: " + code + ")");
            }
            if (code == CODE_GENERAL_ERROR) {
                throw new ProviderUnavailableException("wandou api general error: " + msg + " (code: " + code + ")");
            }
            throw new ProviderUnavailableException("wandou api error: " + msg + " (code: " + code + ")");
        }

        List<ProxyLease> leases = new ArrayList<>();
        for (JsonNode item : root.path("data")) {
            String ip = item.path("ip").asText("");
            int port = item.path("port").asInt(0);
            if (ip.isEmpty() || port <= 0) {
                log.warn("wandou lease skipped, item={}", item);
                continue;
            }
            leases.add(ProxyLease.builder()
                .ip(ip)
                .port(port)
                .protocol("http")
                .expiresAt(parseExpireTime(item.path("expire_time").asText("")))
                .build());
        }
        return leases;
    }

    private Instant parseExpireTime(String expireTime) {
        if (!StringUtils.hasText(expireTime)) {
            return null;
        }
        try {
            return LocalDateTime.parse(expireTime, EXPIRE_TIME_FORMATTER).atZone(zoneId).toInstant();
        } catch (DateTimeParseException ex) {
            log.warn("wandou expire time unparsable, value={}", expireTime);
            return null;
        }
    }

}
