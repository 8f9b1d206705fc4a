package fun.fengwk.mcrawl.core.configuration;

import fun.fengwk.mcrawl.core.model.LoginType;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Login and verification configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.login")
public class LoginProperties {

    private LoginType loginType = LoginType.QRCODE;

    /**
     * Phone number for sms login.
     */
    private String phone = "";

    /**
     * Cookie string for cookie login, for example a=1; b=2.
     */
    private String cookies = "";

    /**
     * Whether to persist cookies after a successful login.
     */
    private boolean saveLoginState = true;

    /**
     * Root directory of persisted sessions.
     */
    private String sessionRoot = System.getProperty("user.home") + "/.media-crawler/sessions";

    /**
     * Directory the login qrcode image is written to.
     */
    private String qrCodeDir = System.getProperty("java.io.tmpdir") + "/media-crawler";

    /**
     * Login confirmation polls before giving up.
     */
    private int loginCheckAttempts = 600;

    private long loginCheckIntervalMs = 1000;

    /**
     * Max wait for the sms code.
     */
    private long smsCodeTimeoutMs = 120000;

    /**
     * Max slider drags per login.
     */
    private int maxSliderAttempts = 20;

    /**
     * Drags on one challenge before a fresh challenge is requested.
     */
    private int sliderAttemptsPerChallenge = 3;

    /**
     * Wait for the verification overlay to disappear after a drag.
     */
    private long sliderHiddenTimeoutMs = 1000;

}
