package fun.fengwk.mcrawl.core.service.crawl;

/**
 * @author fengwk
 */
public enum TaskKind {

    LOGIN,
    SEARCH,
    DETAIL,
    CREATOR,
    COMMENTS

}
