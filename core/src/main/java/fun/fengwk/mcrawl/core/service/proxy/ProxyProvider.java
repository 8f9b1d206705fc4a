package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;

import java.util.List;

/**
 * Source of fresh proxy leases.
 *
 * @author fengwk
 */
public interface ProxyProvider {

    String name();

    /**
     * Fetch up to {@code count} new leases.
     *
     * @param count requested lease count
     * @return leases, possibly fewer than requested
     * @throws fun.fengwk.mcrawl.core.exception.ProviderUnavailableException if the provider call fails
     */
    List<ProxyLease> fetchLeases(int count);

}
