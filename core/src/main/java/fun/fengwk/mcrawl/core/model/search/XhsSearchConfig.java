package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param sortType general, popularity_descending or time_descending
 * @param noteType 0 all, 1 video, 2 image
 * @author fengwk
 */
public record XhsSearchConfig(String sortType, int noteType) implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.XHS;
    }

    @Override
    public int pageSize() {
        return 20;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("sort", sortType, "note_type", String.valueOf(noteType));
    }

}
