package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.configuration.LoginProperties;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import lombok.extern.slf4j.Slf4j;

/**
 * Restores or establishes the logged in session of a platform run.
 *
 * @author fengwk
 */
@Slf4j
public class SessionBootstrap {

    private final LoginProperties loginProperties;
    private final LoginStateMachine loginStateMachine;
    private final SessionStateStore sessionStateStore;
    private final LoginPageFactory loginPageFactory;

    /**
     * @param sessionStateStore may be null to disable session persistence
     * @param loginPageFactory  may be null when no browser is available
     */
    public SessionBootstrap(LoginProperties loginProperties, LoginStateMachine loginStateMachine,
                            SessionStateStore sessionStateStore, LoginPageFactory loginPageFactory) {
        this.loginProperties = loginProperties;
        this.loginStateMachine = loginStateMachine;
        this.sessionStateStore = sessionStateStore;
        this.loginPageFactory = loginPageFactory;
    }

    /**
     * @throws fun.fengwk.mcrawl.core.exception.LoginFailedException if login verification failed
     */
    public SessionState establish(PlatformApi platformApi, ProxyLease lease) {
        SessionState session = null;
        if (isPersistenceEnabled()) {
            session = sessionStateStore.load(platformApi.platform(), loginProperties.getLoginType()).orElse(null);
        }
        if (session == null) {
            session = new SessionState(platformApi.platform(), loginProperties.getLoginType());
        }

        LoginResult result = loginStateMachine.ensureLoggedIn(session, new SessionGuard(platformApi), loginPageFactory, lease);
        if (result.usedBrowser() && isPersistenceEnabled()) {
            sessionStateStore.save(session);
        }
        platformApi.updateCookies(session);
        return session;
    }

    private boolean isPersistenceEnabled() {
        return loginProperties.isSaveLoginState() && sessionStateStore != null;
    }

}
