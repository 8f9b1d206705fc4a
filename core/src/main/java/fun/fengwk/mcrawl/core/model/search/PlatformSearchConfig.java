package fun.fengwk.mcrawl.core.model.search;

import fun.fengwk.mcrawl.core.model.Platform;

import java.util.Map;

/**
 * Typed search settings of one platform, resolved once at startup.
 *
 * @author fengwk
 */
public interface PlatformSearchConfig {

    Platform platform();

    /**
     * Items per search page the platform returns.
     */
    int pageSize();

    /**
     * Platform query parameters derived from the settings.
     */
    Map<String, String> toSearchParams();

}
