package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.exception.PoolExhaustedException;
import fun.fengwk.mcrawl.core.exception.ProviderUnavailableException;
import fun.fengwk.mcrawl.core.exception.ProxyValidationException;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.retry.RetryPolicy;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Pool of single-use proxy leases.
 *
 * <p>Leases are drawn uniformly at random and removed on issue, there is no release. The pool is reloaded
 * from the provider only once it is empty.
 *
 * @author fengwk
 */
@Slf4j
public class ProxyIpPool {

    private final ProxyProvider provider;
    private final ProxyValidator validator;
    private final int poolSize;
    private final boolean validateIp;
    private final RetryPolicy acquireRetryPolicy;
    private final Random random;
    private final Clock clock;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<ProxyLease> leases = new ArrayList<>();
    private final AtomicLong reloadCount = new AtomicLong();

    public ProxyIpPool(ProxyProvider provider, ProxyValidator validator, int poolSize, boolean validateIp,
                       int acquireAttempts, long acquireWaitMs) {
        this(provider, validator, poolSize, validateIp,
            RetryPolicy.fixed(acquireAttempts, acquireWaitMs, ProxyIpPool::isRetryable), null, Clock.systemUTC());
    }

    ProxyIpPool(ProxyProvider provider, ProxyValidator validator, int poolSize, boolean validateIp,
                RetryPolicy acquireRetryPolicy, Random random, Clock clock) {
        this.provider = provider;
        this.validator = validator;
        this.poolSize = Math.max(1, poolSize);
        this.validateIp = validateIp;
        this.acquireRetryPolicy = acquireRetryPolicy;
        this.random = random;
        this.clock = clock;
    }

    /**
     * Load the first batch eagerly.
     */
    public void warmUp() {
        lock.lock();
        try {
            if (leases.isEmpty()) {
                reload();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Draw one lease.
     *
     * @return a lease no other caller has received
     * @throws PoolExhaustedException if no valid lease was obtained within the bounded attempts
     */
    public ProxyLease acquire() {
        try {
            return acquireRetryPolicy.execute("proxy-acquire", this::acquireOnce);
        } catch (PoolExhaustedException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new PoolExhaustedException("acquire proxy failed: " + ex.getMessage(), ex);
        }
    }

    public int size() {
        lock.lock();
        try {
            return leases.size();
        } finally {
            lock.unlock();
        }
    }

    public long getReloadCount() {
        return reloadCount.get();
    }

    private ProxyLease acquireOnce() {
        ProxyLease lease;
        lock.lock();
        try {
            purgeExpired();
            if (leases.isEmpty()) {
                reload();
            }
            if (leases.isEmpty()) {
                throw new PoolExhaustedException("provider returned no usable lease, provider=" + provider.name());
            }
            lease = leases.remove(nextIndex(leases.size()));
        } finally {
            lock.unlock();
        }

        if (validateIp && !validator.validate(lease)) {
            log.info("proxy lease discarded after probe, proxy={}", lease.address());
            throw new ProxyValidationException("proxy lease failed probe: " + lease.address());
        }
        return lease;
    }

    private void reload() {
        List<ProxyLease> fetched = provider.fetchLeases(poolSize);
        reloadCount.incrementAndGet();
        leases.clear();
        if (fetched != null) {
            for (ProxyLease lease : fetched) {
                if (lease != null && !lease.isExpired(clock.instant())) {
                    leases.add(lease);
                }
            }
        }
        log.info("proxy pool reloaded, provider={}, requested={}, loaded={}", provider.name(), poolSize, leases.size());
    }

    private void purgeExpired() {
        Iterator<ProxyLease> iterator = leases.iterator();
        while (iterator.hasNext()) {
            ProxyLease lease = iterator.next();
            if (lease.isExpired(clock.instant())) {
                iterator.remove();
                log.debug("expired proxy lease dropped, proxy={}", lease.address());
            }
        }
    }

    private int nextIndex(int bound) {
        return random == null ? ThreadLocalRandom.current().nextInt(bound) : random.nextInt(bound);
    }

    static boolean isRetryable(Throwable throwable) {
        return throwable instanceof ProxyValidationException
            || throwable instanceof ProviderUnavailableException
            || throwable instanceof PoolExhaustedException;
    }

}
