package fun.fengwk.mcrawl.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import fun.fengwk.mcrawl.core.configuration.LoginProperties;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.ProxyLease;
import fun.fengwk.mcrawl.core.service.login.LoginPage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
public class BrowserLoginRuntimeTest {

    @TempDir
    Path tempDir;

    private BrowserProperties browserProperties;
    private LoginProperties loginProperties;
    private Playwright playwright;
    private BrowserType browserType;
    private BrowserContext context;
    private Page page;

    @BeforeEach
    public void setUp() {
        browserProperties = new BrowserProperties();
        browserProperties.setUserDataRoot(tempDir.resolve("browser-data").toString());
        LoginSelectors selectors = new LoginSelectors();
        selectors.setIndexUrl("https://www.xiaohongshu.com");
        browserProperties.getPlatforms().put(Platform.XHS, selectors);
        loginProperties = new LoginProperties();
        loginProperties.setQrCodeDir(tempDir.resolve("qrcode").toString());

        playwright = mock(Playwright.class);
        browserType = mock(BrowserType.class);
        context = mock(BrowserContext.class);
        page = mock(Page.class);
        when(playwright.chromium()).thenReturn(browserType);
        when(context.pages()).thenReturn(List.of(page));
    }

    @Test
    public void shouldLaunchProfileThroughLeaseProxy() {
        when(browserType.launchPersistentContext(any(Path.class), any(BrowserType.LaunchPersistentContextOptions.class)))
            .thenReturn(context);
        BrowserLoginRuntime runtime = new BrowserLoginRuntime(browserProperties, loginProperties, () -> playwright);
        ProxyLease lease = ProxyLease.builder().ip("1.2.3.4").port(8080).username("u").password("p").build();

        LoginPage loginPage = runtime.open(Platform.XHS, lease);

        ArgumentCaptor<Path> dirCaptor = ArgumentCaptor.forClass(Path.class);
        ArgumentCaptor<BrowserType.LaunchPersistentContextOptions> optionsCaptor =
            ArgumentCaptor.forClass(BrowserType.LaunchPersistentContextOptions.class);
        verify(browserType).launchPersistentContext(dirCaptor.capture(), optionsCaptor.capture());
        assertThat(dirCaptor.getValue()).isEqualTo(tempDir.resolve("browser-data/xhs").toAbsolutePath().normalize());
        assertThat(Files.isDirectory(dirCaptor.getValue())).isTrue();
        BrowserType.LaunchPersistentContextOptions options = optionsCaptor.getValue();
        assertThat(options.proxy.server).isEqualTo("http://1.2.3.4:8080");
        assertThat(options.proxy.username).isEqualTo("u");
        assertThat(options.proxy.password).isEqualTo("p");
        assertThat(options.headless).isFalse();
        verify(context).addInitScript(anyString());
        verify(page).navigate(eq("https://www.xiaohongshu.com"), any(Page.NavigateOptions.class));
        assertThat(loginPage).isInstanceOf(PlaywrightLoginPage.class);
    }

    @Test
    public void shouldLaunchWithoutProxyWhenNoLease() {
        when(browserType.launchPersistentContext(any(Path.class), any(BrowserType.LaunchPersistentContextOptions.class)))
            .thenReturn(context);
        BrowserLoginRuntime runtime = new BrowserLoginRuntime(browserProperties, loginProperties, () -> playwright);

        runtime.open(Platform.XHS, null);

        ArgumentCaptor<BrowserType.LaunchPersistentContextOptions> optionsCaptor =
            ArgumentCaptor.forClass(BrowserType.LaunchPersistentContextOptions.class);
        verify(browserType).launchPersistentContext(any(Path.class), optionsCaptor.capture());
        assertThat(optionsCaptor.getValue().proxy).isNull();
    }

    @Test
    public void shouldClosePlaywrightWhenLaunchFails() {
        when(browserType.launchPersistentContext(any(Path.class), any(BrowserType.LaunchPersistentContextOptions.class)))
            .thenThrow(new PlaywrightException("browser missing"));
        BrowserLoginRuntime runtime = new BrowserLoginRuntime(browserProperties, loginProperties, () -> playwright);

        assertThatThrownBy(() -> runtime.open(Platform.XHS, null))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("failed to open login browser: browser missing");
        verify(playwright).close();
    }

    @Test
    public void shouldRejectPlatformWithoutLoginPage() {
        BrowserLoginRuntime runtime = new BrowserLoginRuntime(browserProperties, loginProperties, () -> playwright);

        assertThatThrownBy(() -> runtime.open(Platform.ZHIHU, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("login page is not configured");
        verify(playwright, never()).chromium();
    }

}
