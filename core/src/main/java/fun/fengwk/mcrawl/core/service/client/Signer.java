package fun.fengwk.mcrawl.core.service.client;

import fun.fengwk.mcrawl.core.service.login.SessionState;

import java.util.Map;

/**
 * Produces the anti-bot signature headers of a request.
 *
 * @author fengwk
 */
@FunctionalInterface
public interface Signer {

    Signer NONE = (request, session) -> Map.of();

    Map<String, String> sign(PlatformRequest request, SessionState session);

}
