package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Expiring cache of leases a provider bought but has not handed out yet.
 *
 * <p>Entries expire slightly before the lease itself so a drained lease still has usable lifetime.
 *
 * @author fengwk
 */
public class ProxyLeaseCache {

    private final String keyPrefix;
    private final Duration safetyMargin;
    private final Clock clock;
    private final Map<String, ProxyLease> entries = new LinkedHashMap<>();

    public ProxyLeaseCache(String keyPrefix, Duration safetyMargin) {
        this(keyPrefix, safetyMargin, Clock.systemUTC());
    }

    ProxyLeaseCache(String keyPrefix, Duration safetyMargin, Clock clock) {
        this.keyPrefix = keyPrefix;
        this.safetyMargin = safetyMargin;
        this.clock = clock;
    }

    public synchronized void put(ProxyLease lease) {
        if (isStale(lease)) {
            return;
        }
        entries.put(key(lease), lease);
    }

    /**
     * Remove and return up to {@code max} live leases.
     */
    public synchronized List<ProxyLease> drain(int max) {
        evictStale();
        List<ProxyLease> drained = new ArrayList<>();
        Iterator<ProxyLease> iterator = entries.values().iterator();
        while (iterator.hasNext() && drained.size() < max) {
            drained.add(iterator.next());
            iterator.remove();
        }
        return drained;
    }

    public synchronized int size() {
        evictStale();
        return entries.size();
    }

    private void evictStale() {
        entries.values().removeIf(this::isStale);
    }

    private boolean isStale(ProxyLease lease) {
        if (lease.getExpiresAt() == null) {
            return false;
        }
        return !lease.getExpiresAt().minus(safetyMargin).isAfter(clock.instant());
    }

    private String key(ProxyLease lease) {
        // one endpoint may be sold under several accounts
        return keyPrefix + "_" + lease.getIp() + "_" + lease.getPort() + "_" + lease.getUsername() + "_" + lease.getPassword();
    }

}
