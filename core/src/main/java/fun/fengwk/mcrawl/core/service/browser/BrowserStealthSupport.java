package fun.fengwk.mcrawl.core.service.browser;

import com.microsoft.playwright.BrowserContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Anti-detection init script of login browser contexts.
 *
 * <p>Script source in order of precedence: the configured script file (e.g. a stealth.min.js bundle),
 * the inline script, the built-in fallback.
 *
 * @author fengwk
 */
@Slf4j
public final class BrowserStealthSupport {

    static final String FALLBACK_SCRIPT = """
        (() => {
          const hide = (target, name, value) => {
            try {
              Object.defineProperty(target, name, { get: () => value });
            } catch (e) {}
          };
          hide(navigator, 'webdriver', undefined);
          hide(navigator, 'languages', ['zh-CN', 'zh', 'en']);
          hide(navigator, 'plugins', [1, 2, 3, 4, 5]);
          try {
            window.chrome = window.chrome || { runtime: {} };
          } catch (e) {}
          try {
            const getParameter = WebGLRenderingContext.prototype.getParameter;
            WebGLRenderingContext.prototype.getParameter = function (parameter) {
              if (parameter === 37445) {
                return 'Intel Inc.';
              }
              if (parameter === 37446) {
                return 'Intel Iris OpenGL Engine';
              }
              return getParameter.call(this, parameter);
            };
          } catch (e) {}
        })();
        """;

    private BrowserStealthSupport() {
    }

    /**
     * @return script to install, empty when stealth is disabled
     * @throws IllegalStateException if the configured script file cannot be read
     */
    public static String resolveScript(BrowserProperties properties) {
        if (!properties.isStealthEnabled()) {
            return "";
        }
        if (StringUtils.hasText(properties.getStealthScriptFile())) {
            Path file = Paths.get(properties.getStealthScriptFile());
            try {
                return Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException ex) {
                throw new IllegalStateException("failed to read stealth script, file=" + file, ex);
            }
        }
        if (StringUtils.hasText(properties.getStealthScript())) {
            return properties.getStealthScript();
        }
        return FALLBACK_SCRIPT;
    }

    public static void apply(BrowserContext context, BrowserProperties properties) {
        String script = resolveScript(properties);
        if (!StringUtils.hasText(script)) {
            return;
        }
        context.addInitScript(script);
        log.debug("stealth script installed, length={}", script.length());
    }

}
