package fun.fengwk.mcrawl.core.model;

import lombok.Builder;
import lombok.Value;
import lombok.ToString;

import java.time.Instant;

/**
 * A single-use proxy endpoint handed out by the proxy pool.
 *
 * @author fengwk
 */
@Value
@Builder
public class ProxyLease {

    String ip;

    int port;

    String username;

    @ToString.Exclude
    String password;

    /**
     * Proxy scheme, always http.
     */
    @Builder.Default
    String protocol = "http";

    /**
     * Expiry instant, null means the provider gave none.
     */
    Instant expiresAt;

    public String address() {
        return ip + ":" + port;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !expiresAt.isAfter(now);
    }

    /**
     * Proxy server url without credentials, for example http://1.2.3.4:8080.
     */
    public String serverUrl() {
        return protocol + "://" + address();
    }

}
