package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.model.CrawlMode;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.proxy.ProxyIpPool;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * One unit of crawl work and the proxy lease it exclusively owns.
 *
 * @author fengwk
 */
@Slf4j
public class CrawlTask {

    private final Platform platform;
    private final CrawlMode mode;
    private final TaskKind kind;
    private final String target;
    private final ProxyIpPool proxyIpPool;
    private final AtomicInteger attempts = new AtomicInteger();
    private volatile String cursor = "";
    private ProxyLease lease;

    public CrawlTask(Platform platform, CrawlMode mode, TaskKind kind, String target, ProxyIpPool proxyIpPool) {
        this.platform = platform;
        this.mode = mode;
        this.kind = kind;
        this.target = target;
        this.proxyIpPool = proxyIpPool;
    }

    public Platform getPlatform() {
        return platform;
    }

    public CrawlMode getMode() {
        return mode;
    }

    public TaskKind getKind() {
        return kind;
    }

    public String getTarget() {
        return target;
    }

    public String getCursor() {
        return cursor;
    }

    public void setCursor(String cursor) {
        this.cursor = cursor == null ? "" : cursor;
    }

    /**
     * Attempts spent on the latest request.
     */
    public int getAttempts() {
        return attempts.get();
    }

    void resetAttempts() {
        attempts.set(0);
    }

    int recordAttempt() {
        return attempts.incrementAndGet();
    }

    /**
     * Current lease, drawn from the pool on first use. Null when proxies are disabled.
     *
     * @throws fun.fengwk.mcrawl.core.exception.PoolExhaustedException if no lease can be drawn
     */
    public synchronized ProxyLease currentLease() {
        if (proxyIpPool == null) {
            return null;
        }
        if (lease == null) {
            lease = proxyIpPool.acquire();
            log.debug("proxy lease taken, task={}, proxy={}", describe(), lease.address());
        }
        return lease;
    }

    /**
     * Drop the current lease, the next {@link #currentLease()} draws a new one.
     *
     * @return dropped lease, may be null
     */
    public synchronized ProxyLease evictLease() {
        ProxyLease evicted = lease;
        lease = null;
        return evicted;
    }

    public String describe() {
        return platform.getCode() + "/" + kind.name().toLowerCase() + "/" + target;
    }

    @Override
    public String toString() {
        return describe();
    }

}
