package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param sortType 0 time descending, 1 time ascending, 2 relevance
 * @param noteType 0 all posts, 1 main threads only
 * @author fengwk
 */
public record TiebaSearchConfig(int sortType, int noteType) implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.TIEBA;
    }

    @Override
    public int pageSize() {
        return 10;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("sm", String.valueOf(sortType), "only_thread", String.valueOf(noteType));
    }

}
