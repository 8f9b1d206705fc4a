package fun.fengwk.mcrawl.core.service.proxy;

import fun.fengwk.mcrawl.core.model.ProxyLease;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface ProxyValidator {

    /**
     * @return true if the lease can reach the outside world
     */
    boolean validate(ProxyLease lease);

}
