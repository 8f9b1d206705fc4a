package fun.fengwk.mcrawl.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Proxy pool configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.proxy")
public class ProxyProperties {

    /**
     * Whether crawl requests go through pooled proxies.
     */
    private boolean enabled = false;

    /**
     * Provider name, wandouhttp, jisuhttp or static.
     */
    private String provider = "wandouhttp";

    /**
     * Leases fetched per reload.
     */
    private int poolSize = 2;

    /**
     * Whether to probe a lease before handing it out.
     */
    private boolean validateIp = true;

    /**
     * Echo endpoint used to probe leases.
     */
    private String validateUrl = "https://echo.apifox.cn/";

    /**
     * Probe timeout.
     */
    private long validateTimeoutMs = 10000;

    /**
     * Connect timeout of http clients routed through leases.
     */
    private long connectTimeoutMs = 10000;

    /**
     * Max attempts of one acquire.
     */
    private int acquireAttempts = 3;

    /**
     * Wait between acquire attempts.
     */
    private long acquireWaitMs = 1000;

    /**
     * Proxies of the static provider, host:port or user:password@host:port, optionally with scheme.
     */
    private List<String> staticProxies = new ArrayList<>();

    private Wandou wandou = new Wandou();

    private Jishu jishu = new Jishu();

    public int normalizePoolSize() {
        return Math.max(1, poolSize);
    }

    @Data
    public static class Wandou {

        /**
         * Extraction api url.
         */
        private String apiUrl = "https://api.wandouapp.com/";

        /**
         * Account app key.
         */
        private String appKey = "";

        /**
         * Zone of the expire_time field.
         */
        private String zoneId = "Asia/Shanghai";

        /**
         * Request timeout.
         */
        private long timeoutMs = 10000;

    }

    @Data
    public static class Jishu {

        /**
         * Fetchips api url.
         */
        private String apiUrl = "https://api.jisuhttp.com/fetchips";

        /**
         * Extraction key.
         */
        private String key = "";

        /**
         * Signature issued with the key.
         */
        private String crypto = "";

        /**
         * Lease validity in minutes, one of 3, 5, 10, 15 or 30.
         */
        private int timeMinutes = 30;

        /**
         * Value of the port parameter, 1 asks for plain http proxies.
         */
        private int protocolType = 1;

        /**
         * Zone of the expire field.
         */
        private String zoneId = "Asia/Shanghai";

        /**
         * Request timeout.
         */
        private long timeoutMs = 10000;

    }

}
