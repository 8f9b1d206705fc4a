package fun.fengwk.mcrawl.core.service.browser;

import fun.fengwk.mcrawl.core.model.Platform;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Browser configuration of login sessions.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.browser")
public class BrowserProperties {

    /**
     * Whether the login browser runs headless, qrcode login usually needs a headed browser.
     */
    private boolean headless = false;

    /**
     * Root directory of persistent browser profiles, one per platform.
     */
    private String userDataRoot = System.getProperty("user.home") + "/.media-crawler/browser-data";

    private long navigateTimeoutMs = 30000;

    /**
     * Playwright steps per slider track segment, more steps move slower.
     */
    private int sliderMoveSteps = 10;

    private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private String locale = "zh-CN";

    /**
     * Browser channel, e.g. chrome, msedge.
     */
    private String browserChannel = "";

    private List<String> launchArgs = List.of("--disable-blink-features=AutomationControlled");

    /**
     * Ignore default args for browser launch.
     */
    private List<String> ignoreDefaultArgs = List.of("--enable-automation");

    private boolean stealthEnabled = true;

    /**
     * Inline stealth script, empty uses the built-in one.
     */
    private String stealthScript = "";

    /**
     * Stealth script file, takes precedence over the inline script.
     */
    private String stealthScriptFile = "";

    private Map<Platform, LoginSelectors> platforms = new EnumMap<>(Platform.class);

    public LoginSelectors resolveSelectors(Platform platform) {
        LoginSelectors selectors = platforms == null ? null : platforms.get(platform);
        if (selectors == null || !StringUtils.hasText(selectors.getIndexUrl())) {
            throw new IllegalArgumentException("login page is not configured, platform=" + platform);
        }
        return selectors;
    }

}
