package fun.fengwk.mcrawl.core.service.crawl;

import fun.fengwk.mcrawl.core.configuration.CrawlerProperties;
import fun.fengwk.mcrawl.core.exception.LoginFailedException;
import fun.fengwk.mcrawl.core.exception.NotFoundException;
import fun.fengwk.mcrawl.core.exception.PoolExhaustedException;
import fun.fengwk.mcrawl.core.model.CommentNode;
import fun.fengwk.mcrawl.core.model.ContentItem;
import fun.fengwk.mcrawl.core.model.CrawlMode;
import fun.fengwk.mcrawl.core.model.CrawlRecord;
import fun.fengwk.mcrawl.core.model.CreatorProfile;
import fun.fengwk.mcrawl.core.model.PageResult;
import fun.fengwk.mcrawl.core.model.Platform;
import fun.fengwk.mcrawl.core.model.search.PlatformSearchConfig;
import fun.fengwk.mcrawl.core.service.client.PlatformApi;
import fun.fengwk.mcrawl.core.service.client.SearchQuery;
import fun.fengwk.mcrawl.core.service.comment.CommentFetchResult;
import fun.fengwk.mcrawl.core.service.comment.PaginatedCommentTreeFetcher;
import fun.fengwk.mcrawl.core.service.login.SessionBootstrap;
import fun.fengwk.mcrawl.core.service.proxy.ProxyIpPool;
import fun.fengwk.mcrawl.core.service.retry.BackoffScheduler;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Runs search, detail, creator and comment crawls of one platform.
 *
 * <p>One instance serves one platform run. Items are processed by a bounded worker pool, pages of one
 * keyword or creator are fetched in order. A failure is confined to the smallest unit it affects: the
 * item, the keyword or the creator. Only a failed login or an exhausted proxy pool at login aborts the run.
 *
 * @author fengwk
 */
@Slf4j
public class CrawlOrchestrator implements AutoCloseable {

    private final PlatformApi platformApi;
    private final Platform platform;
    private final CrawlerProperties crawlerProperties;
    private final PlatformSearchConfig searchConfig;
    private final RequestExecutor requestExecutor;
    private final ProxyIpPool proxyIpPool;
    private final BackoffScheduler backoffScheduler;
    private final PersistenceSink persistenceSink;
    private final SessionBootstrap sessionBootstrap;
    private final CancellationToken cancellationToken = new CancellationToken();
    private final BoundedWorkerPool workerPool;
    private final PaginatedCommentTreeFetcher commentFetcher;
    private final CrawlReport report;

    /**
     * @param proxyIpPool      may be null when proxies are disabled
     * @param sessionBootstrap may be null to skip the login gate
     */
    public CrawlOrchestrator(PlatformApi platformApi, CrawlerProperties crawlerProperties,
                             PlatformSearchConfig searchConfig, RequestExecutor requestExecutor,
                             ProxyIpPool proxyIpPool, BackoffScheduler backoffScheduler,
                             PersistenceSink persistenceSink, SessionBootstrap sessionBootstrap) {
        this.platformApi = platformApi;
        this.platform = platformApi.platform();
        this.crawlerProperties = crawlerProperties;
        this.searchConfig = searchConfig;
        this.requestExecutor = requestExecutor;
        this.proxyIpPool = proxyIpPool;
        this.backoffScheduler = backoffScheduler;
        this.persistenceSink = persistenceSink;
        this.sessionBootstrap = sessionBootstrap;
        this.workerPool = new BoundedWorkerPool(platform.getCode(), crawlerProperties.normalizeMaxConcurrency(), cancellationToken);
        this.commentFetcher = new PaginatedCommentTreeFetcher(platformApi, requestExecutor, backoffScheduler,
            crawlerProperties.isEnableSubComments(), cancellationToken);
        this.report = new CrawlReport(platform, null);
    }

    /**
     * Log in if needed, then run the requested mode.
     *
     * @return report of the run, ABORTED if the login failed
     */
    public CrawlReport start(CrawlRequest request) {
        report.setMode(request.getMode());
        log.info("crawl started, platform={}, mode={}", platform, request.getMode());
        try {
            establishSession();
            switch (request.getMode()) {
                case SEARCH:
                    int pageLimit = request.getPageLimit() > 0
                        ? request.getPageLimit()
                        : crawlerProperties.resolveSearchPageLimit(searchConfig.pageSize());
                    runSearch(request.getKeywords(), pageLimit);
                    break;
                case DETAIL:
                    runDetail(request.getContentIds());
                    break;
                case CREATOR:
                    runCreator(request.getCreatorIds());
                    break;
                default:
                    throw new IllegalArgumentException("unsupported crawl mode: " + request.getMode());
            }
            report.finish(cancellationToken.isCancelled());
        } catch (LoginFailedException | PoolExhaustedException ex) {
            log.error("crawl aborted, platform={}, mode={}, error={}", platform, request.getMode(), ex.getMessage());
            report.abort(ex.getMessage());
        } finally {
            close();
        }
        log.info("crawl finished, report={}", report);
        return report;
    }

    /**
     * Stop dequeuing new items, running requests finish.
     */
    public void cancel() {
        if (cancellationToken.cancel()) {
            log.info("crawl cancel requested, platform={}", platform);
        }
    }

    @Override
    public void close() {
        workerPool.close();
    }

    public boolean isCancelled() {
        return cancellationToken.isCancelled();
    }

    public CrawlReport getReport() {
        return report;
    }

    /**
     * Page through the search results of each keyword, then crawl details and comments of the found items.
     *
     * @return ids of contents whose detail was fetched
     */
    public List<String> runSearch(List<String> keywords, int pageLimit) {
        Set<String> seen = new LinkedHashSet<>();
        List<String> fetched = new ArrayList<>();
        for (String keyword : keywords) {
            if (cancellationToken.isCancelled()) {
                break;
            }
            List<String> ids = searchKeyword(keyword, pageLimit, seen);
            List<String> detailed = fetchDetails(CrawlMode.SEARCH, ids, keyword);
            batchGetComments(detailed);
            fetched.addAll(detailed);
        }
        return fetched;
    }

    /**
     * Crawl details of the given contents, then their comments.
     *
     * @return ids of contents whose detail was fetched
     */
    public List<String> runDetail(List<String> contentIds) {
        List<String> detailed = fetchDetails(CrawlMode.DETAIL, contentIds, null);
        batchGetComments(detailed);
        return detailed;
    }

    /**
     * Crawl each creator's profile and content list, then details and comments of the contents.
     *
     * @return ids of contents whose detail was fetched
     */
    public List<String> runCreator(List<String> creatorIds) {
        List<String> fetched = new ArrayList<>();
        for (String creatorId : creatorIds) {
            if (cancellationToken.isCancelled()) {
                break;
            }
            List<String> detailed = crawlCreator(creatorId);
            batchGetComments(detailed);
            fetched.addAll(detailed);
        }
        return fetched;
    }

    /**
     * Crawl comment trees of the given contents, skipped when comments are disabled.
     *
     * @return fetch result per content that succeeded
     */
    public Map<String, CommentFetchResult> batchGetComments(List<String> contentIds) {
        if (!crawlerProperties.isEnableComments()) {
            log.info("comment crawl disabled, platform={}, contents={}", platform, contentIds.size());
            return Map.of();
        }
        if (contentIds.isEmpty()) {
            return Map.of();
        }
        List<TaskOutcome<String, CommentFetchResult>> outcomes = workerPool.runAll("comments", contentIds, this::fetchComments);
        Map<String, CommentFetchResult> results = new LinkedHashMap<>();
        for (TaskOutcome<String, CommentFetchResult> outcome : outcomes) {
            if (outcome.isSuccess()) {
                results.put(outcome.item(), outcome.result());
            }
        }
        return results;
    }

    private void establishSession() {
        if (sessionBootstrap == null) {
            return;
        }
        CrawlTask task = newTask(report.getMode(), TaskKind.LOGIN, platform.getCode());
        sessionBootstrap.establish(platformApi, task.currentLease());
    }

    private List<String> searchKeyword(String keyword, int pageLimit, Set<String> seen) {
        CrawlTask task = newTask(CrawlMode.SEARCH, TaskKind.SEARCH, keyword);
        int maxNotes = crawlerProperties.getMaxNotesCount();
        List<String> ids = new ArrayList<>();
        int page = crawlerProperties.getStartPage();
        int pagesFetched = 0;
        while (pagesFetched < pageLimit && !cancellationToken.isCancelled() && (maxNotes <= 0 || ids.size() < maxNotes)) {
            SearchQuery query = new SearchQuery(keyword, page, task.getCursor(), searchConfig);
            PageResult<ContentItem> result;
            try {
                result = requestExecutor.call(task, "search-page-" + page, lease -> platformApi.search(query, lease));
            } catch (Exception ex) {
                report.recordFailure(TaskFailure.of(task, ex));
                log.error("search page failed, keyword stopped, platform={}, keyword={}, page={}, attempts={}, error={}",
                    platform, keyword, page, task.getAttempts(), ex.getMessage());
                break;
            }
            pagesFetched++;
            backoffScheduler.pause();

            if (result.isEmpty()) {
                log.info("search results exhausted, platform={}, keyword={}, page={}", platform, keyword, page);
                break;
            }
            for (ContentItem item : result.items()) {
                if (maxNotes > 0 && ids.size() >= maxNotes) {
                    break;
                }
                if (item.getId() != null && seen.add(item.getId())) {
                    ids.add(item.getId());
                }
            }
            log.info("search page fetched, platform={}, keyword={}, page={}, items={}, collected={}",
                platform, keyword, page, result.items().size(), ids.size());
            if (!result.hasMore()) {
                break;
            }
            task.setCursor(result.cursor());
            page++;
        }
        return ids;
    }

    private List<String> crawlCreator(String creatorId) {
        CrawlTask task = newTask(CrawlMode.CREATOR, TaskKind.CREATOR, creatorId);
        CreatorProfile profile;
        try {
            profile = requestExecutor.call(task, "creator-profile", lease -> platformApi.getCreatorProfile(creatorId, lease));
        } catch (Exception ex) {
            report.recordFailure(TaskFailure.of(task, ex));
            log.error("creator profile failed, creator skipped, platform={}, creatorId={}, attempts={}, error={}",
                platform, creatorId, task.getAttempts(), ex.getMessage());
            return List.of();
        }
        persistenceSink.save(List.of(CrawlRecord.creator(platform, profile)));
        report.addCreators(1);
        backoffScheduler.pause();

        int maxNotes = crawlerProperties.getMaxNotesCount();
        List<String> detailed = new ArrayList<>();
        int collected = 0;
        while (!cancellationToken.isCancelled() && (maxNotes <= 0 || collected < maxNotes)) {
            String cursor = task.getCursor();
            PageResult<ContentItem> page;
            try {
                page = requestExecutor.call(task, "creator-contents", lease -> platformApi.getCreatorContents(creatorId, cursor, lease));
            } catch (Exception ex) {
                report.recordFailure(TaskFailure.of(task, ex));
                log.error("creator contents failed, creator stopped, platform={}, creatorId={}, cursor={}, attempts={}, error={}",
                    platform, creatorId, cursor, task.getAttempts(), ex.getMessage());
                break;
            }
            backoffScheduler.pause();

            List<String> pageIds = new ArrayList<>();
            for (ContentItem item : page.items()) {
                if (maxNotes > 0 && collected >= maxNotes) {
                    break;
                }
                pageIds.add(item.getId());
                collected++;
            }
            log.info("creator contents fetched, platform={}, creatorId={}, items={}, collected={}",
                platform, creatorId, pageIds.size(), collected);
            detailed.addAll(fetchDetails(CrawlMode.CREATOR, pageIds, null));
            if (!page.hasMore() || page.isEmpty()) {
                break;
            }
            task.setCursor(page.cursor());
        }
        return detailed;
    }

    private List<String> fetchDetails(CrawlMode mode, List<String> contentIds, String sourceKeyword) {
        if (contentIds.isEmpty()) {
            return List.of();
        }
        List<TaskOutcome<String, ContentItem>> outcomes = workerPool.runAll("detail", contentIds,
            contentId -> fetchDetail(mode, contentId, sourceKeyword));
        return outcomes.stream()
            .filter(TaskOutcome::isSuccess)
            .map(TaskOutcome::item)
            .collect(Collectors.toList());
    }

    private ContentItem fetchDetail(CrawlMode mode, String contentId, String sourceKeyword) {
        CrawlTask task = newTask(mode, TaskKind.DETAIL, contentId);
        try {
            ContentItem item = requestExecutor.call(task, "detail", lease -> platformApi.getDetail(contentId, lease));
            persistenceSink.save(List.of(CrawlRecord.content(platform, item, sourceKeyword)));
            report.addContents(1);
            return item;
        } catch (NotFoundException ex) {
            report.recordFailure(TaskFailure.of(task, ex));
            log.warn("content not found or withdrawn, platform={}, contentId={}, error={}", platform, contentId, ex.getMessage());
            return null;
        } catch (Exception ex) {
            report.recordFailure(TaskFailure.of(task, ex));
            log.error("content detail failed, platform={}, contentId={}, attempts={}, error={}",
                platform, contentId, task.getAttempts(), ex.getMessage(), ex);
            return null;
        } finally {
            backoffScheduler.pause();
        }
    }

    private CommentFetchResult fetchComments(String contentId) {
        CrawlTask task = newTask(report.getMode(), TaskKind.COMMENTS, contentId);
        try {
            CommentFetchResult result = commentFetcher.fetchAllComments(task, contentId,
                crawlerProperties.getMaxCommentsPerNote(), this::saveComments);
            log.info("comments fetched, platform={}, contentId={}, roots={}, replies={}",
                platform, contentId, result.rootComments(), result.subComments());
            return result;
        } catch (NotFoundException ex) {
            report.recordFailure(TaskFailure.of(task, ex));
            log.warn("comments unavailable, platform={}, contentId={}, error={}", platform, contentId, ex.getMessage());
            return null;
        } catch (Exception ex) {
            report.recordFailure(TaskFailure.of(task, ex));
            log.error("comments failed, platform={}, contentId={}, attempts={}, error={}",
                platform, contentId, task.getAttempts(), ex.getMessage(), ex);
            return null;
        }
    }

    private void saveComments(String contentId, List<CommentNode> comments) {
        List<CrawlRecord> records = new ArrayList<>(comments.size());
        for (CommentNode comment : comments) {
            if (comment.getContentId() == null) {
                comment.setContentId(contentId);
            }
            records.add(CrawlRecord.comment(platform, comment));
        }
        persistenceSink.save(records);
        report.addComments(records.size());
    }

    private CrawlTask newTask(CrawlMode mode, TaskKind kind, String target) {
        return new CrawlTask(platform, mode, kind, target, proxyIpPool);
    }

}
