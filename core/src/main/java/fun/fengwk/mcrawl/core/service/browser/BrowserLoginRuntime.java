package fun.fengwk.mcrawl.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.options.Proxy;
import com.microsoft.playwright.options.WaitUntilState;
import fun.fengwk.mcrawl.core.configuration.LoginProperties;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.login.LoginPage;
import fun.fengwk.mcrawl.core.service.login.LoginPageFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Opens Playwright login pages, one persistent browser profile per platform.
 *
 * @author fengwk
 */
@Slf4j
public class BrowserLoginRuntime implements LoginPageFactory {

    private final BrowserProperties browserProperties;
    private final LoginProperties loginProperties;
    private final PlaywrightFactory playwrightFactory;

    public BrowserLoginRuntime(BrowserProperties browserProperties, LoginProperties loginProperties) {
        this(browserProperties, loginProperties, Playwright::create);
    }

    BrowserLoginRuntime(BrowserProperties browserProperties, LoginProperties loginProperties,
                        PlaywrightFactory playwrightFactory) {
        this.browserProperties = browserProperties;
        this.loginProperties = loginProperties;
        this.playwrightFactory = playwrightFactory;
    }

    @Override
    public LoginPage open(Platform platform, ProxyLease lease) {
        LoginSelectors selectors = browserProperties.resolveSelectors(platform);
        Playwright playwright = null;
        try {
            Path userDataDir = resolveUserDataDir(platform);
            playwright = playwrightFactory.create();
            BrowserContext context = playwright.chromium().launchPersistentContext(userDataDir, buildContextOptions(lease));
            BrowserStealthSupport.apply(context, browserProperties);
            Page page = context.pages().isEmpty() ? context.newPage() : context.pages().get(0);
            page.navigate(selectors.getIndexUrl(), new Page.NavigateOptions()
                .setWaitUntil(WaitUntilState.DOMCONTENTLOADED)
                .setTimeout((double) browserProperties.getNavigateTimeoutMs()));
            log.info("login browser opened, platform={}, url={}, proxy={}",
                platform, selectors.getIndexUrl(), lease == null ? "none" : lease.address());
            return new PlaywrightLoginPage(platform, playwright, context, page, selectors,
                browserProperties.getSliderMoveSteps(), Paths.get(loginProperties.getQrCodeDir()));
        } catch (Exception ex) {
            if (playwright != null) {
                try {
                    playwright.close();
                } catch (Exception closeEx) {
                    ex.addSuppressed(closeEx);
                }
            }
            log.warn("login browser open failed, platform={}, error={}", platform, ex.getMessage());
            throw new IllegalStateException("failed to open login browser: " + ex.getMessage(), ex);
        }
    }

    public Path resolveUserDataDir(Platform platform) {
        try {
            Path rootDir = Paths.get(browserProperties.getUserDataRoot()).toAbsolutePath().normalize();
            Path userDataDir = rootDir.resolve(platform.getCode()).normalize();
            Files.createDirectories(userDataDir);
            return userDataDir;
        } catch (Exception ex) {
            throw new IllegalStateException("failed to resolve user data dir: " + ex.getMessage(), ex);
        }
    }

    private BrowserType.LaunchPersistentContextOptions buildContextOptions(ProxyLease lease) {
        BrowserType.LaunchPersistentContextOptions options = new BrowserType.LaunchPersistentContextOptions()
            .setHeadless(browserProperties.isHeadless());
        if (StringUtils.hasText(browserProperties.getUserAgent())) {
            options.setUserAgent(browserProperties.getUserAgent());
        }
        if (StringUtils.hasText(browserProperties.getLocale())) {
            options.setLocale(browserProperties.getLocale());
        }
        if (StringUtils.hasText(browserProperties.getBrowserChannel())) {
            options.setChannel(browserProperties.getBrowserChannel());
        }
        if (browserProperties.getLaunchArgs() != null && !browserProperties.getLaunchArgs().isEmpty()) {
            options.setArgs(browserProperties.getLaunchArgs());
        }
        if (browserProperties.getIgnoreDefaultArgs() != null && !browserProperties.getIgnoreDefaultArgs().isEmpty()) {
            options.setIgnoreDefaultArgs(browserProperties.getIgnoreDefaultArgs());
        }
        if (lease != null) {
            Proxy proxy = new Proxy(lease.serverUrl());
            if (lease.hasCredentials()) {
                proxy.setUsername(lease.getUsername());
                proxy.setPassword(lease.getPassword());
            }
            options.setProxy(proxy);
        }
        return options;
    }

    @FunctionalInterface
    interface PlaywrightFactory {

        Playwright create();

    }

}
