package fun.fengwk.mcrawl.cli.crawler;

import fun.fengwk.mcrawl.core.model.CrawlMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Crawl job launched by the command line.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "mcrawl.job")
public class JobProperties {

    /**
     * Platform codes to crawl, e.g. xhs,dy.
     */
    private List<String> platforms = new ArrayList<>();

    /**
     * Crawl mode applied to every platform.
     */
    private CrawlMode mode = CrawlMode.SEARCH;

    /**
     * Comma separated search keywords.
     */
    private String keywords = "";

    /**
     * Content ids for detail mode.
     */
    private List<String> ids = new ArrayList<>();

    /**
     * Creator ids for creator mode.
     */
    private List<String> creatorIds = new ArrayList<>();

    /**
     * Max search pages per keyword, non-positive derives it from the notes limit.
     */
    private int pageLimit = 0;

}
