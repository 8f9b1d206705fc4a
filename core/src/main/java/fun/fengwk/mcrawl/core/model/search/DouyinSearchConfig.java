package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param publishTimeType 0 unlimited, 1 one day, 7 one week, 180 half a year
 * @param sortType        0 general, 1 most liked, 2 latest
 * @author fengwk
 */
public record DouyinSearchConfig(int publishTimeType, int sortType) implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.DOUYIN;
    }

    @Override
    public int pageSize() {
        return 10;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("publish_time", String.valueOf(publishTimeType), "sort_type", String.valueOf(sortType));
    }

}
