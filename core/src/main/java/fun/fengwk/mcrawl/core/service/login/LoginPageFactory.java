package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;

/**
 * @author fengwk
 */
@FunctionalInterface
public interface LoginPageFactory {

    LoginPage open(Platform platform, ProxyLease lease);

}
