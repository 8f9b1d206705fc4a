package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.exception.ProviderUnavailableException;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Provider serving a fixed proxy list, each reload hands out every entry once.
 *
 * <p>Entries are {@code [http://][user:pass@]host[:port]}, other schemes are refused.
 *
 * @author fengwk
 */
@Slf4j
public class StaticProxyProvider implements ProxyProvider {

    private final List<ProxyLease> proxies;

    public StaticProxyProvider(List<String> proxyStrings) {
        List<ProxyLease> parsed = new ArrayList<>();
        if (proxyStrings != null) {
            for (String proxyString : proxyStrings) {
                if (StringUtils.hasText(proxyString)) {
                    parsed.add(parseProxy(proxyString.trim()));
                }
            }
        }
        this.proxies = Collections.unmodifiableList(parsed);
    }

    @Override
    public String name() {
        return "static";
    }

    @Override
    public List<ProxyLease> fetchLeases(int count) {
        if (proxies.isEmpty()) {
            throw new ProviderUnavailableException("static proxy list is empty");
        }
        List<ProxyLease> shuffled = new ArrayList<>(proxies);
        Collections.shuffle(shuffled);
        return shuffled.subList(0, Math.min(Math.max(1, count), shuffled.size()));
    }

    static ProxyLease parseProxy(String proxyString) {
        try {
            String uriString = proxyString;
            if (!uriString.contains("://")) {
                uriString = "http://" + uriString;
            }
            URI uri = new URI(uriString);
            String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!"http".equals(scheme)) {
                // the JDK http client speaks plain http to its proxy, socks and tls proxies are unsupported
                throw new IllegalArgumentException("unsupported proxy scheme: " + scheme);
            }
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                throw new IllegalArgumentException("missing host");
            }
            if (port == -1) {
                port = 80;
            }
            String username = null;
            String password = null;
            String userInfo = uri.getUserInfo();
            if (StringUtils.hasText(userInfo)) {
                int split = userInfo.indexOf(':');
                username = split >= 0 ? userInfo.substring(0, split) : userInfo;
                password = split >= 0 ? userInfo.substring(split + 1) : null;
            }
            return ProxyLease.builder()
                .ip(host)
                .port(port)
                .username(username)
                .password(password)
                .protocol(scheme)
                .build();
        } catch (Exception ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyString, ex);
        }
    }

}
