package fun.fengwk.mcrawl.core.service.login;

import fun.fengwk.mcrawl.core.model.LoginType;
import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cookie jar and login status of one platform run.
 *
 * <p>Readable from any worker thread, mutated only by the login package.
 *
 * @author fengwk
 */
public class SessionState {

    private final Platform platform;
    private final LoginType loginType;
    private volatile SessionStatus status = SessionStatus.NOT_LOGGED_IN;
    private volatile Map<String, String> cookies = Map.of();

    public SessionState(Platform platform, LoginType loginType) {
        this.platform = platform;
        this.loginType = loginType;
    }

    public Platform getPlatform() {
        return platform;
    }

    public LoginType getLoginType() {
        return loginType;
    }

    public SessionStatus getStatus() {
        return status;
    }

    public boolean isLoggedIn() {
        return status == SessionStatus.LOGGED_IN;
    }

    public Map<String, String> getCookies() {
        return cookies;
    }

    public String cookieHeader() {
        return CookieUtils.toHeader(cookies);
    }

    void updateStatus(SessionStatus status) {
        this.status = status;
    }

    void replaceCookies(Map<String, String> cookies) {
        this.cookies = cookies == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(cookies));
    }

    @Override
    public String toString() {
        return "SessionState{platform=" + platform + ", status=" + status + ", cookies=" + cookies.keySet() + "}";
    }

}
