package fun.fengwk.mcrawl.core.service.browser;

import lombok.Data;

/**
 * Index page and login widgets of one platform.
 *
 * @author fengwk
 */
@Data
public class LoginSelectors {

    /**
     * Page opened for login.
     */
    private String indexUrl = "";

    /**
     * Domain injected cookies are bound to, for example .xiaohongshu.com.
     */
    private String cookieDomain = "";

    /**
     * Button opening the login dialog, empty when the dialog shows up by itself.
     */
    private String loginButton = "";

    private String qrCodeImage = "";

    /**
     * Tab switching the dialog to phone login.
     */
    private String phoneTab = "";

    private String phoneInput = "";

    private String sendSmsButton = "";

    private String smsCodeInput = "";

    private String submitButton = "";

    /**
     * Verification overlay, visible while a slider challenge is pending.
     */
    private String sliderContainer = "";

    private String sliderHandle = "";

    private String sliderRefreshButton = "";

    /**
     * Cookie whose presence marks a logged in session.
     */
    private String loginCookieName = "";

    /**
     * Required value of the login cookie, empty accepts any value.
     */
    private String loginCookieValue = "";

    /**
     * Local storage key marking a logged in session.
     */
    private String loginLocalStorageKey = "";

    private String loginLocalStorageValue = "";

}
