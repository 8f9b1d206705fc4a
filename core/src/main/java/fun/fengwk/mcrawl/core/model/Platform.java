package fun.fengwk.mcrawl.core.model;

import java.util.Locale;

/**
 * Supported media platforms.
 *
 * @author fengwk
 */
public enum Platform {

    XHS("xhs"),
    DOUYIN("dy"),
    KUAISHOU("ks"),
    BILIBILI("bili"),
    WEIBO("wb"),
    TIEBA("tieba"),
    ZHIHU("zhihu");

    private final String code;

    Platform(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Resolve platform from its short code or enum name, case insensitive.
     *
     * @param value code or name
     * @return platform
     * @throws IllegalArgumentException if value matches no platform
     */
    public static Platform fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("platform is blank");
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.code.equals(normalized) || platform.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return platform;
            }
        }
        throw new IllegalArgumentException("unsupported platform: " + value);
    }

}
