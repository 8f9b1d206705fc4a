package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * Kuaishou search has no tunable settings.
 *
 * @author fengwk
 */
public record KuaishouSearchConfig() implements PlatformSearchConfig {

    @Override
    public Platform platform() {
        return Platform.KUAISHOU;
    }

    @Override
    public int pageSize() {
        return 20;
    }

    @Override
    public Map<String, String> toSearchParams() {
        return Map.of();
    }

}
