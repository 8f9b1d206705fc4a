package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param searchType default, real_time, popular or video
 * @author fengwk
 */
public record WeiboSearchConfig(String searchType) implements PlatformSearchConfig {

    private static final Map<String, String> SEARCH_TYPE_CODES = Map.of(
        "default", "1",
        "real_time", "61",
        "popular", "60",
        "video", "64"
    );

    @Override
    public Platform platform() {
        return Platform.WEIBO;
    }

    @Override
    public int pageSize() {
        return 10;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("search_type", SEARCH_TYPE_CODES.get(searchType));
    }

    public static boolean isSupported(String searchType) {
        return SEARCH_TYPE_CODES.containsKey(searchType);
    }

}
