package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Session liveness check deciding whether a login is needed.
 *
 * @author fengwk
 */
@Slf4j
@RequiredArgsConstructor
public class SessionGuard {

    private final PlatformApi platformApi;

    /**
     * Check cookies first, fall back to the platform probe.
     */
    public boolean isAuthenticated(SessionState session, ProxyLease lease) {
        Map<String, String> cookies = session.getCookies();
        if (!cookies.isEmpty() && platformApi.hasLoginCookie(cookies)) {
            log.debug("session authenticated by cookie, platform={}", session.getPlatform());
            return true;
        }
        try {
            return platformApi.pong(session, lease);
        } catch (RuntimeException ex) {
            log.info("session probe failed, treat as logged out, platform={}, error={}",
                session.getPlatform(), ex.getMessage());
            return false;
        }
    }

}
