package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ProxyLeaseCacheTest {

    private static final Instant NOW = Instant.parse("2024-06-01T00:00:00Z");

    private final ProxyLeaseCache cache = new ProxyLeaseCache("TEST", Duration.ofSeconds(5),
        Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    public void shouldDropLeasesInsideSafetyMargin() {
        cache.put(lease("a", NOW.plusSeconds(60)));
        cache.put(lease("b", NOW.plusSeconds(3)));
        cache.put(lease("c", null));

        assertThat(cache.size()).isEqualTo(2);
    }

    @Test
    public void shouldRemoveDrainedLeases() {
        cache.put(lease("a", NOW.plusSeconds(60)));
        cache.put(lease("b", NOW.plusSeconds(60)));

        List<ProxyLease> first = cache.drain(1);
        List<ProxyLease> second = cache.drain(5);

        assertThat(first).extracting(ProxyLease::getIp).containsExactly("a");
        assertThat(second).extracting(ProxyLease::getIp).containsExactly("b");
        assertThat(cache.size()).isZero();
    }

    @Test
    public void shouldKeepOneEntryPerEndpoint() {
        cache.put(lease("a", NOW.plusSeconds(60)));
        cache.put(lease("a", NOW.plusSeconds(120)));

        List<ProxyLease> drained = cache.drain(5);

        assertThat(drained).hasSize(1);
        assertThat(drained.get(0).getExpiresAt()).isEqualTo(NOW.plusSeconds(120));
    }

    @Test
    public void shouldKeepEndpointLeasesOfDifferentAccounts() {
        cache.put(ProxyLease.builder().ip("a").port(9000).username("u1").password("p1").build());
        cache.put(ProxyLease.builder().ip("a").port(9000).username("u2").password("p2").build());

        assertThat(cache.drain(5)).extracting(ProxyLease::getUsername).containsExactly("u1", "u2");
    }

    private static ProxyLease lease(String ip, Instant expiresAt) {
        return ProxyLease.builder().ip(ip).port(9000).expiresAt(expiresAt).build();
    }

}
