package fun.fengwk.mcrawl.core.service.client;

import fun.fengwk.mcrawl.core.model.ProxyLease;

/**
 * Transport of one platform.
 *
 * @author fengwk
 */
public interface PlatformClient {

    /**
     * Send a request, routed through the lease when one is given.
     *
     * @param request request to send
     * @param lease   proxy lease, null for a direct connection
     * @return response with a 2xx status
     * @throws fun.fengwk.mcrawl.core.exception.BlockedException          rate limited or verification required
     * @throws fun.fengwk.mcrawl.core.exception.NotFoundException         item missing
     * @throws fun.fengwk.mcrawl.core.exception.TransientRequestException network or server failure
     */
    PlatformResponse request(PlatformRequest request, ProxyLease lease);

}
