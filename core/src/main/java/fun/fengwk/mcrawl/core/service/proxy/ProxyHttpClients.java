package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;
import lombok.extern.slf4j.Slf4j;

import java.net.Authenticator;
import java.net.InetSocketAddress;
import java.net.PasswordAuthentication;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Clock;
import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Http clients routed through proxy leases, one client per lease.
 *
 * <p>A lease keeps its client until it is released, expires or falls out of the size bound, so every
 * request of a task shares one connection pool and selector thread.
 *
 * @author fengwk
 */
@Slf4j
public class ProxyHttpClients {

    /**
     * JDK switch listing auth schemes refused for CONNECT tunnels, Basic by default.
     */
    public static final String TUNNEL_DISABLED_SCHEMES_PROPERTY = "jdk.http.auth.tunneling.disabledSchemes";

    public static final int DEFAULT_MAX_CLIENTS = 64;

    static {
        enableTunnelBasicAuth();
    }

    private final Duration connectTimeout;
    private final int maxClients;
    private final Clock clock;
    private final HttpClient directClient;
    private final Map<ProxyLease, HttpClient> clients = new LinkedHashMap<>(16, 0.75f, true);

    public ProxyHttpClients(Duration connectTimeout) {
        this(connectTimeout, DEFAULT_MAX_CLIENTS, Clock.systemUTC());
    }

    ProxyHttpClients(Duration connectTimeout, int maxClients, Clock clock) {
        this.connectTimeout = connectTimeout;
        this.maxClients = Math.max(1, maxClients);
        this.clock = clock;
        this.directClient = build(null, connectTimeout);
    }

    /**
     * Let proxy credentials reach CONNECT tunnels, so credentialed leases work for https targets.
     *
     * <p>The JDK reads the switch once, when the first http client is built, so this has to run before
     * that. An explicitly configured value is kept.
     */
    public static void enableTunnelBasicAuth() {
        if (System.getProperty(TUNNEL_DISABLED_SCHEMES_PROPERTY) == null) {
            System.setProperty(TUNNEL_DISABLED_SCHEMES_PROPERTY, "");
        }
    }

    /**
     * @param lease may be null for a direct connection
     * @return client of the lease, built on first use
     */
    public HttpClient clientFor(ProxyLease lease) {
        if (lease == null) {
            return directClient;
        }
        synchronized (clients) {
            purgeExpired();
            HttpClient client = clients.get(lease);
            if (client == null) {
                client = build(lease, connectTimeout);
                clients.put(lease, client);
                trimToSize();
            }
            return client;
        }
    }

    /**
     * Drop the client of a lease that will not be used again.
     */
    public void release(ProxyLease lease) {
        if (lease == null) {
            return;
        }
        synchronized (clients) {
            if (clients.remove(lease) != null) {
                log.debug("proxy client released, proxy={}", lease.address());
            }
        }
    }

    public int size() {
        synchronized (clients) {
            return clients.size();
        }
    }

    private void purgeExpired() {
        Iterator<ProxyLease> iterator = clients.keySet().iterator();
        while (iterator.hasNext()) {
            if (iterator.next().isExpired(clock.instant())) {
                iterator.remove();
            }
        }
    }

    private void trimToSize() {
        Iterator<ProxyLease> iterator = clients.keySet().iterator();
        while (clients.size() > maxClients && iterator.hasNext()) {
            ProxyLease eldest = iterator.next();
            iterator.remove();
            log.debug("proxy client evicted by size bound, proxy={}, maxClients={}", eldest.address(), maxClients);
        }
    }

    static HttpClient build(ProxyLease lease, Duration connectTimeout) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(connectTimeout)
            .followRedirects(HttpClient.Redirect.NORMAL);
        if (lease == null) {
            return builder.build();
        }
        builder.proxy(ProxySelector.of(new InetSocketAddress(lease.getIp(), lease.getPort())));
        if (lease.hasCredentials()) {
            String username = lease.getUsername();
            char[] password = lease.getPassword() == null ? new char[0] : lease.getPassword().toCharArray();
            builder.authenticator(new Authenticator() {
                @Override
                protected PasswordAuthentication getPasswordAuthentication() {
                    if (getRequestorType() != RequestorType.PROXY) {
                        return null;
                    }
                    return new PasswordAuthentication(username, password);
                }
            });
        }
        return builder.build();
    }

}
