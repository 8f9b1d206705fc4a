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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Provider backed by the jisu http fetchips api.
 *
 * <p>Leases come with account credentials and an expire time, surplus leases wait in the cache.
 *
 * @author fengwk
 */
@Slf4j
public class JishuHttpProxyProvider implements ProxyProvider {

    static final int MAX_BATCH = 100;

    private static final DateTimeFormatter EXPIRE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");
    private static final int CODE_OK = 0;

    private final ProxyProperties.Jishu properties;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ProxyLeaseCache leaseCache;
    private final ZoneId zoneId;

    public JishuHttpProxyProvider(ProxyProperties.Jishu properties, HttpClient httpClient,
                                  ObjectMapper objectMapper, ProxyLeaseCache leaseCache) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.leaseCache = leaseCache;
        this.zoneId = ZoneId.of(properties.getZoneId());
    }

    @Override
    public String name() {
        return "jisuhttp";
    }

    @Override
    public List<ProxyLease> fetchLeases(int count) {
        int wanted = Math.min(Math.max(1, count), MAX_BATCH);
        List<ProxyLease> result = new ArrayList<>(leaseCache.drain(wanted));
        if (result.size() >= wanted) {
            log.debug("jisu leases served from cache, count={}", result.size());
            return result;
        }

        for (ProxyLease lease : requestLeases(wanted - result.size())) {
            leaseCache.put(lease);
        }
        result.addAll(leaseCache.drain(wanted - result.size()));
        return result;
    }

    private List<ProxyLease> requestLeases(int num) {
        if (!StringUtils.hasText(properties.getKey()) || !StringUtils.hasText(properties.getCrypto())) {
            throw new ProviderUnavailableException("jisu key or crypto is not configured");
        }
        HttpRequest request = HttpRequest.newBuilder(URI.create(properties.getApiUrl() + "?" + buildQuery(num)))
            .timeout(Duration.ofMillis(Math.max(1, properties.getTimeoutMs())))
            .GET()
            .build();

        String body;
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            if (response.statusCode() != 200) {
                throw new ProviderUnavailableException("jisu api http status " + response.statusCode());
            }
            body = response.body();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ProviderUnavailableException("jisu api interrupted", ex);
        } catch (IOException ex) {
            throw new ProviderUnavailableException("jisu api request failed: " + ex.getMessage(), ex);
        }
        return parseLeases(body);
    }

    String buildQuery(int num) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("key", properties.getKey());
        params.put("crypto", properties.getCrypto());
        params.put("time", String.valueOf(properties.getTimeMinutes()));
        params.put("type", "json");
        params.put("port", String.valueOf(properties.getProtocolType()));
        // account auth and expire times in the response
        params.put("pw", "1");
        params.put("se", "1");
        params.put("num", String.valueOf(num));
        return params.entrySet().stream()
            .map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    List<ProxyLease> parseLeases(String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException ex) {
            throw new ProviderUnavailableException("jisu api returned invalid json", ex);
        }
        int code = root.path("code").asInt(-1);
        if (code != CODE_OK) {
            String msg = root.path("msg").asText("unknown error");
            throw new ProviderUnavailableException("jisu api error: " + msg + " (code: " + code + ")");
        }

        List<ProxyLease> leases = new ArrayList<>();
        for (JsonNode item : root.path("data")) {
            String ip = item.path("ip").asText("");
            int port = item.path("port").asInt(0);
            if (ip.isEmpty() || port <= 0) {
                log.warn("jisu lease skipped, item={}", item.path("ip"));
                continue;
            }
            leases.add(ProxyLease.builder()
                .ip(ip)
                .port(port)
                .username(textOrNull(item, "user"))
                .password(textOrNull(item, "pass"))
                .protocol("http")
                .expiresAt(parseExpire(item.path("expire").asText("")))
                .build());
        }
        log.info("jisu leases fetched, count={}", leases.size());
        return leases;
    }

    private static String textOrNull(JsonNode item, String field) {
        String value = item.path(field).asText("");
        return value.isEmpty() ? null : value;
    }

    private Instant parseExpire(String expire) {
        if (!StringUtils.hasText(expire)) {
            return null;
        }
        try {
            return LocalDateTime.parse(expire, EXPIRE_FORMATTER).atZone(zoneId).toInstant();
        } catch (DateTimeParseException ex) {
            log.warn("jisu expire time unparsable, value={}", expire);
            return null;
        }
    }

}
