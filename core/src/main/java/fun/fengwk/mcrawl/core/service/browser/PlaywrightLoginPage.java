package fun.fengwk.mcrawl.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Mouse;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.options.BoundingBox;
import com.microsoft.playwright.options.Cookie;
import com.microsoft.playwright.options.WaitForSelectorState;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.service.login.LoginPage;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link LoginPage} over a Playwright page.
 *
 * @author fengwk
 */
@Slf4j
public class PlaywrightLoginPage implements LoginPage {

    private static final double QR_CODE_WAIT_MS = 10000;

    private final Platform platform;
    private final Playwright playwright;
    private final BrowserContext context;
    private final Page page;
    private final LoginSelectors selectors;
    private final int moveSteps;
    private final Path qrCodeDir;

    public PlaywrightLoginPage(Platform platform, Playwright playwright, BrowserContext context, Page page,
                               LoginSelectors selectors, int moveSteps, Path qrCodeDir) {
        this.platform = platform;
        this.playwright = playwright;
        this.context = context;
        this.page = page;
        this.selectors = selectors;
        this.moveSteps = Math.max(1, moveSteps);
        this.qrCodeDir = qrCodeDir;
    }

    @Override
    public void openLoginDialog() {
        clickIfVisible(selectors.getLoginButton());
    }

    @Override
    public boolean displayQrCode() {
        if (!StringUtils.hasText(selectors.getQrCodeImage())) {
            return false;
        }
        Locator image = page.locator(selectors.getQrCodeImage()).first();
        try {
            image.waitFor(new Locator.WaitForOptions().setState(WaitForSelectorState.VISIBLE).setTimeout(QR_CODE_WAIT_MS));
            Files.createDirectories(qrCodeDir);
            Path imagePath = qrCodeDir.resolve(platform.getCode() + "-login-qrcode.png");
            image.screenshot(new Locator.ScreenshotOptions().setPath(imagePath));
            log.info("scan the login qrcode to continue, platform={}, image={}", platform, imagePath);
            return true;
        } catch (PlaywrightException ex) {
            log.warn("login qrcode not found, platform={}, error={}", platform, ex.getMessage());
            return false;
        } catch (Exception ex) {
            throw new IllegalStateException("failed to save login qrcode: " + ex.getMessage(), ex);
        }
    }

    @Override
    public void requestSmsCode(String phone) {
        clickIfVisible(selectors.getPhoneTab());
        page.locator(selectors.getPhoneInput()).first().fill(phone);
        page.locator(selectors.getSendSmsButton()).first().click();
    }

    @Override
    public void submitSmsCode(String code) {
        page.locator(selectors.getSmsCodeInput()).first().fill(code);
        page.locator(selectors.getSubmitButton()).first().click();
    }

    @Override
    public void injectCookies(Map<String, String> cookies) {
        List<Cookie> browserCookies = new ArrayList<>();
        cookies.forEach((name, value) -> browserCookies.add(
            new Cookie(name, value).setDomain(selectors.getCookieDomain()).setPath("/")
        ));
        context.addCookies(browserCookies);
        page.reload();
    }

    @Override
    public boolean isSliderVisible() {
        return isVisible(selectors.getSliderContainer());
    }

    @Override
    public void dragSlider(List<Integer> track) {
        BoundingBox box = page.locator(selectors.getSliderHandle()).first().boundingBox();
        if (box == null) {
            throw new IllegalStateException("slider handle not found, platform=" + platform);
        }
        double x = box.x + box.width / 2;
        double y = box.y + box.height / 2;
        Mouse mouse = page.mouse();
        mouse.move(x, y);
        mouse.down();
        for (int delta : track) {
            x += delta;
            mouse.move(x, y, new Mouse.MoveOptions().setSteps(moveSteps));
        }
        mouse.up();
    }

    @Override
    public boolean awaitSliderHidden(long timeoutMs) {
        try {
            page.locator(selectors.getSliderContainer()).first().waitFor(new Locator.WaitForOptions()
                .setState(WaitForSelectorState.HIDDEN)
                .setTimeout((double) Math.max(1, timeoutMs)));
            return true;
        } catch (PlaywrightException ex) {
            return false;
        }
    }

    @Override
    public void refreshSliderChallenge() {
        clickIfVisible(selectors.getSliderRefreshButton());
    }

    @Override
    public boolean isLoginConfirmed() {
        if (StringUtils.hasText(selectors.getLoginCookieName())) {
            String value = cookies().get(selectors.getLoginCookieName());
            if (value != null && (!StringUtils.hasText(selectors.getLoginCookieValue())
                || selectors.getLoginCookieValue().equals(value))) {
                return true;
            }
        }
        if (StringUtils.hasText(selectors.getLoginLocalStorageKey())) {
            try {
                Object stored = page.evaluate("key => window.localStorage.getItem(key)", selectors.getLoginLocalStorageKey());
                return stored != null && Objects.equals(String.valueOf(stored), selectors.getLoginLocalStorageValue());
            } catch (PlaywrightException ex) {
                log.debug("read local storage failed, platform={}, error={}", platform, ex.getMessage());
            }
        }
        return false;
    }

    @Override
    public Map<String, String> cookies() {
        Map<String, String> cookies = new LinkedHashMap<>();
        for (Cookie cookie : context.cookies()) {
            cookies.put(cookie.name, cookie.value);
        }
        return cookies;
    }

    @Override
    public void close() {
        try {
            context.close();
        } finally {
            playwright.close();
        }
    }

    private boolean isVisible(String selector) {
        if (!StringUtils.hasText(selector)) {
            return false;
        }
        try {
            return page.locator(selector).first().isVisible();
        } catch (PlaywrightException ex) {
            return false;
        }
    }

    private void clickIfVisible(String selector) {
        if (isVisible(selector)) {
            page.locator(selector).first().click();
        }
    }

}
