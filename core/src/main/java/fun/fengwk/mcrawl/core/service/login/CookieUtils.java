package fun.fengwk.mcrawl.core.service.login;

import org.springframework.util.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * @author fengwk
 */
public final class CookieUtils {

    private CookieUtils() {
    }

    /**
     * Parse a cookie header string such as {@code a=1; b=2}.
     */
    public static Map<String, String> parse(String cookieString) {
        Map<String, String> cookies = new LinkedHashMap<>();
        if (!StringUtils.hasText(cookieString)) {
            return cookies;
        }
        for (String pair : cookieString.split(";")) {
            int split = pair.indexOf('=');
            if (split <= 0) {
                continue;
            }
            String name = pair.substring(0, split).trim();
            String value = pair.substring(split + 1).trim();
            if (!name.isEmpty()) {
                cookies.put(name, value);
            }
        }
        return cookies;
    }

    public static String toHeader(Map<String, String> cookies) {
        if (cookies == null || cookies.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner("; ");
        cookies.forEach((name, value) -> joiner.add(name + "=" + (value == null ? "" : value)));
        return joiner.toString();
    }

}
