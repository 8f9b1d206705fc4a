package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.model.CrawlMode;
import fun.fengwk.mcrawl.core.model.Platform;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class CrawlRequest {

    private Platform platform;

    private CrawlMode mode;

    @Builder.Default
    private List<String> keywords = List.of();

    @Builder.Default
    private List<String> contentIds = List.of();

    @Builder.Default
    private List<String> creatorIds = List.of();

    /**
     * Max search pages per keyword, non-positive uses the configured limit.
     */
    private int pageLimit;

}
