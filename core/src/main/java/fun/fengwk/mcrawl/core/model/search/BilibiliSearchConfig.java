package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * @param order totalrank, pubdate, click, dm or stow
 * @author fengwk
 */
public record BilibiliSearchConfig(String order) implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.BILIBILI;
    }

    @Override
    public int pageSize() {
        return 20;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of("order", order);
    }

}
