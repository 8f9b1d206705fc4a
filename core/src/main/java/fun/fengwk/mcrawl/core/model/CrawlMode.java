package fun.fengwk.mcrawl.core.model;

/**
 * Crawl run mode.
 *
 * @author fengwk
 */
public enum CrawlMode {

    /**
     * Keyword search, then detail and comments of discovered items.
     */
    SEARCH,

    /**
     * Detail and comments of explicit content ids.
     */
    DETAIL,

    /**
     * Creator profile, its content list, then details and comments.
     */
    CREATOR

}
