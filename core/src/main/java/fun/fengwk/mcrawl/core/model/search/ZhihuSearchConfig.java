package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param sort      empty for relevance, upvoted_count or created_time
 * @param timeRange empty for unlimited, a_day, a_week, a_month or three_months
 * @author fengwk
 */
public record ZhihuSearchConfig(String sort, String timeRange) implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.ZHIHU;
    }

    @Override
    public int pageSize() {
        return 20;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("sort", sort, "time_interval", timeRange);
    }

}
